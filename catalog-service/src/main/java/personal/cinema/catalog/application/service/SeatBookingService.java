package personal.cinema.catalog.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.cinema.catalog.application.port.in.BookSeatsCommand;
import personal.cinema.catalog.application.port.in.BookSeatsUseCase;
import personal.cinema.catalog.domain.model.BookingCatalog;
import personal.cinema.catalog.domain.model.BookingResult;
import personal.cinema.common.result.Result;

/**
 * Seat Booking Service (SRP)
 * 단일 책임: 좌석 예약 처리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeatBookingService implements BookSeatsUseCase {

    private final BookingCatalog bookingCatalog;

    @Override
    public Result<BookingResult> bookSeats(BookSeatsCommand command) {
        Result<BookingResult> result = bookingCatalog.book(
                command.movieId(), command.theaterId(), command.seatNumbers());

        if (result.isFailure()) {
            log.warn("Screening not found for booking: movieId={}, theaterId={}",
                    command.movieId(), command.theaterId());
            return result;
        }

        BookingResult outcome = result.value();
        if (outcome.isAccepted()) {
            log.info("Seats booked: movieId={}, theaterId={}, seats={}",
                    command.movieId(), command.theaterId(), command.seatNumbers());
        } else {
            log.warn("Booking rejected: movieId={}, theaterId={}, seats={}, result={}, errorCode={}",
                    command.movieId(), command.theaterId(), command.seatNumbers(), outcome,
                    outcome.getErrorCode().getCode());
        }
        return result;
    }
}
