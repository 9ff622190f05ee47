package personal.cinema.catalog.application.port.in;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.util.Objects;
import java.util.Set;

/**
 * Assign Theaters Command
 * 영화에 극장을 연결하는 커맨드
 */
public record AssignTheatersCommand(
        Long movieId,
        Set<Long> theaterIds
) {
    public AssignTheatersCommand {
        if (movieId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Movie ID cannot be null");
        }
        if (theaterIds == null || theaterIds.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Theater IDs cannot be null or empty");
        }
        if (theaterIds.stream().anyMatch(Objects::isNull)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Theater ID cannot be null");
        }
        theaterIds = Set.copyOf(theaterIds);
    }
}
