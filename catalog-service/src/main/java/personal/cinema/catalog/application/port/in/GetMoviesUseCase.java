package personal.cinema.catalog.application.port.in;

import java.util.List;

/**
 * Get Movies UseCase (Input Port)
 * 영화 목록 조회 유스케이스
 */
public interface GetMoviesUseCase {

    /**
     * 영화 목록 조회 (캐시)
     *
     * @return "movieId,title" 줄 목록, 줄 끝은 CRLF
     */
    String getMovies();

    /**
     * 영화 ID 목록 (오름차순, 캐시 없음)
     */
    List<Long> getMovieIds();
}
