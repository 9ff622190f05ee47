package personal.cinema.catalog.application.port.in;

/**
 * Reset Catalog UseCase (Input Port)
 * 카탈로그 전체 초기화 유스케이스
 */
public interface ResetCatalogUseCase {

    /**
     * 모든 영화, 극장, 좌석 인벤토리 삭제
     * 다음 등록부터 ID는 1로 다시 시작한다.
     */
    void reset();
}
