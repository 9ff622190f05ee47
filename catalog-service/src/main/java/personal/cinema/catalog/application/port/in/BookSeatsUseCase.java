package personal.cinema.catalog.application.port.in;

import personal.cinema.catalog.domain.model.BookingResult;
import personal.cinema.common.result.Result;

/**
 * Book Seats UseCase (Input Port)
 * 좌석 예약 유스케이스
 */
public interface BookSeatsUseCase {

    /**
     * 좌석 예약
     * 요청한 좌석이 모두 예약되거나 하나도 예약되지 않는다.
     *
     * @param command 예약 커맨드 (movieId, theaterId, seatNumbers)
     * @return ACCEPTED / NOT_AVAILABLE / INVALID, 또는 상영이 없으면 SCREENING_NOT_FOUND
     */
    Result<BookingResult> bookSeats(BookSeatsCommand command);
}
