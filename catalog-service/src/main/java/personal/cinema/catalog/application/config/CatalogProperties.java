package personal.cinema.catalog.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Catalog 설정 Properties
 * application.yml의 catalog.* 설정을 바인딩
 *
 * @param seatCapacity 상영(영화, 극장)마다 생성되는 좌석 수
 * @param fairLocks    카탈로그/인벤토리 락의 공정(FIFO) 모드 사용 여부
 */
@ConfigurationProperties(prefix = "catalog")
public record CatalogProperties(
        @DefaultValue("20") int seatCapacity,
        @DefaultValue("true") boolean fairLocks
) {
    public CatalogProperties {
        if (seatCapacity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("catalog.seat-capacity must be positive: %d", seatCapacity));
        }
    }
}
