package personal.cinema.catalog.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.cinema.catalog.application.port.in.AssignTheatersCommand;
import personal.cinema.catalog.application.port.in.RegisterCatalogUseCase;
import personal.cinema.catalog.application.port.in.RegisterLabelsCommand;
import personal.cinema.catalog.application.port.in.ResetCatalogUseCase;
import personal.cinema.catalog.domain.model.BookingCatalog;
import personal.cinema.common.result.Result;

import java.util.Set;

/**
 * Catalog Management Service
 * 영화/극장 등록, 상영 연결, 초기화 UseCase 구현
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogManagementService implements RegisterCatalogUseCase, ResetCatalogUseCase {

    private final BookingCatalog bookingCatalog;

    @Override
    public Result<Set<Long>> registerMovies(RegisterLabelsCommand command) {
        Result<Set<Long>> result = bookingCatalog.addMovies(command.labels());
        logRegistration("Movies", command, result);
        return result;
    }

    @Override
    public Result<Set<Long>> registerTheaters(RegisterLabelsCommand command) {
        Result<Set<Long>> result = bookingCatalog.addTheaters(command.labels());
        logRegistration("Theaters", command, result);
        return result;
    }

    @Override
    public Result<Set<Long>> assignTheaters(AssignTheatersCommand command) {
        Result<Set<Long>> result = bookingCatalog.addTheatersToMovie(command.movieId(), command.theaterIds());
        if (result.isSuccess()) {
            log.info("Theaters assigned: movieId={}, theaterIds={}, seatsPerTheater={}",
                    command.movieId(), result.value(), bookingCatalog.seatCapacity());
        } else {
            log.warn("Theater assignment rejected: movieId={}, theaterIds={}, error={}",
                    command.movieId(), command.theaterIds(), result.error().getCode());
        }
        return result;
    }

    @Override
    public void reset() {
        bookingCatalog.clear();
        log.info("Catalog reset");
    }

    private static void logRegistration(String what, RegisterLabelsCommand command, Result<Set<Long>> result) {
        if (result.isSuccess()) {
            log.info("{} registered: count={}, ids={}", what, result.value().size(), result.value());
        } else {
            log.warn("{} registration rejected: labels={}, error={}", what, command.labels(), result.error().getCode());
        }
    }
}
