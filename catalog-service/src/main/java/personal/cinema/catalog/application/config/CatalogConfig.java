package personal.cinema.catalog.application.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.cinema.catalog.domain.model.BookingCatalog;

/**
 * Catalog Configuration
 * 프로세스 전체에서 공유하는 단일 BookingCatalog 빈 등록 (정적 싱글톤 대신 주입)
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogConfig {

    @Bean
    public BookingCatalog bookingCatalog(CatalogProperties properties) {
        log.info("Creating booking catalog: seatCapacity={}, fairLocks={}",
                properties.seatCapacity(), properties.fairLocks());
        return new BookingCatalog(properties.seatCapacity(), properties.fairLocks());
    }
}
