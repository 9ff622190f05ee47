package personal.cinema.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Catalog Service Application
 * 영화/극장 카탈로그와 상영별 좌석 인벤토리를 관리하는 핵심 서비스
 */
@SpringBootApplication(scanBasePackages = "personal.cinema.catalog")
public class CatalogServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CatalogServiceApplication.class, args);
    }
}
