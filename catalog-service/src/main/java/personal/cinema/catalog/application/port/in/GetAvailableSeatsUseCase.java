package personal.cinema.catalog.application.port.in;

import personal.cinema.common.result.Result;

/**
 * Get Available Seats UseCase (Input Port)
 * 예약 가능 좌석 조회 유스케이스
 */
public interface GetAvailableSeatsUseCase {

    /**
     * 예약 가능 좌석 조회 (캐시)
     *
     * @param movieId   영화 ID
     * @param theaterId 극장 ID
     * @return 쉼표로 구분된 좌석 번호 한 줄, 또는 SCREENING_NOT_FOUND
     */
    Result<String> getAvailableSeats(Long movieId, Long theaterId);
}
