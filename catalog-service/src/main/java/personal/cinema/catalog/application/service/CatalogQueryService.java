package personal.cinema.catalog.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.cinema.catalog.application.port.in.GetAvailableSeatsUseCase;
import personal.cinema.catalog.application.port.in.GetMoviesUseCase;
import personal.cinema.catalog.application.port.in.GetTheatersUseCase;
import personal.cinema.catalog.domain.model.BookingCatalog;
import personal.cinema.catalog.domain.model.Snapshot;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.common.result.Result;

import java.util.List;

/**
 * Catalog Query Service
 * 영화, 극장, 좌석 목록 조회 UseCase 구현 (모두 캐시된 스냅샷 반환)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogQueryService implements GetMoviesUseCase, GetTheatersUseCase, GetAvailableSeatsUseCase {

    private final BookingCatalog bookingCatalog;

    @Override
    public String getMovies() {
        Snapshot movies = bookingCatalog.moviesSnapshot();
        log.debug("Movies listed: version={}", movies.version());
        return movies.text();
    }

    @Override
    public List<Long> getMovieIds() {
        return bookingCatalog.sortedMovieIds();
    }

    @Override
    public Result<String> getTheaters(Long movieId) {
        requireId(movieId, "Movie ID");

        Result<Snapshot> theaters = bookingCatalog.theatersForMovie(movieId);
        if (theaters.isFailure()) {
            log.warn("Theaters not listed: movieId={}, error={}", movieId, theaters.error().getCode());
        }
        return theaters.map(Snapshot::text);
    }

    @Override
    public String getAllTheaters() {
        return bookingCatalog.theatersSnapshot().text();
    }

    @Override
    public List<Long> getTheaterIds() {
        return bookingCatalog.sortedTheaterIds();
    }

    @Override
    public Result<String> getAvailableSeats(Long movieId, Long theaterId) {
        requireId(movieId, "Movie ID");
        requireId(theaterId, "Theater ID");

        Result<Snapshot> seats = bookingCatalog.availableSeats(movieId, theaterId);
        if (seats.isFailure()) {
            log.warn("Seats not listed: movieId={}, theaterId={}, error={}",
                    movieId, theaterId, seats.error().getCode());
        } else {
            log.debug("Seats listed: movieId={}, theaterId={}, version={}",
                    movieId, theaterId, seats.value().version());
        }
        return seats.map(Snapshot::text);
    }

    private static void requireId(Long id, String name) {
        if (id == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, name + " cannot be null");
        }
    }
}
