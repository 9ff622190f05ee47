package personal.cinema.catalog.application.port.in;

import personal.cinema.common.result.Result;

import java.util.List;

/**
 * Get Theaters UseCase (Input Port)
 * 극장 목록 조회 유스케이스
 */
public interface GetTheatersUseCase {

    /**
     * 영화를 상영하는 극장 목록 조회 (캐시)
     *
     * @param movieId 영화 ID
     * @return "theaterId,name" 줄 목록, 또는 MOVIE_NOT_FOUND
     */
    Result<String> getTheaters(Long movieId);

    /**
     * 등록된 전체 극장 목록 (캐시)
     */
    String getAllTheaters();

    /**
     * 극장 ID 목록 (오름차순, 캐시 없음)
     */
    List<Long> getTheaterIds();
}
