package personal.cinema.catalog.application.port.in;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.util.Objects;
import java.util.Set;

/**
 * Book Seats Command
 * 좌석 예약 커맨드
 */
public record BookSeatsCommand(
        Long movieId,
        Long theaterId,
        Set<Integer> seatNumbers
) {
    public BookSeatsCommand {
        if (movieId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Movie ID cannot be null");
        }
        if (theaterId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Theater ID cannot be null");
        }
        if (seatNumbers == null || seatNumbers.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat numbers cannot be null");
        }
        seatNumbers = Set.copyOf(seatNumbers);
    }
}
