package personal.cinema.catalog.application.port.in;

import personal.cinema.common.result.Result;

import java.util.Set;

/**
 * Register Catalog UseCase (Input Port)
 * 영화/극장 등록 및 상영 연결 유스케이스
 *
 * 모든 작업은 전부 성공하거나, 실패 시 카탈로그를 전혀 바꾸지 않는다.
 */
public interface RegisterCatalogUseCase {

    /**
     * 영화 일괄 등록
     *
     * @return 부여된 영화 ID, 또는 MOVIE_ALREADY_EXISTS
     */
    Result<Set<Long>> registerMovies(RegisterLabelsCommand command);

    /**
     * 극장 일괄 등록
     *
     * @return 부여된 극장 ID, 또는 THEATER_ALREADY_EXISTS
     */
    Result<Set<Long>> registerTheaters(RegisterLabelsCommand command);

    /**
     * 영화에 극장 연결 (극장마다 빈 좌석 인벤토리 생성)
     *
     * @return 연결된 극장 ID, 또는 MOVIE_NOT_FOUND / THEATER_NOT_FOUND / THEATER_ALREADY_ASSOCIATED
     */
    Result<Set<Long>> assignTheaters(AssignTheatersCommand command);
}
