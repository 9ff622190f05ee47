package personal.cinema.catalog.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.common.exception.ErrorKind;
import personal.cinema.common.result.Result;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BookingCatalog 단위 테스트")
class BookingCatalogTest {

    private static final String ALL_SEATS = seats(0, 19);

    private BookingCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new BookingCatalog();
    }

    private static String seats(int fromInclusive, int toInclusive) {
        return IntStream.rangeClosed(fromInclusive, toInclusive)
                .mapToObj(String::valueOf)
                .collect(Collectors.joining(",")) + "\r\n";
    }

    private long addMovie(String title) {
        return catalog.addMovies(Set.of(title)).value().iterator().next();
    }

    private long addTheater(String name) {
        return catalog.addTheaters(Set.of(name)).value().iterator().next();
    }

    @Nested
    @DisplayName("영화/극장 등록")
    class Registration {

        @Test
        @DisplayName("영화 등록 - 등록 수만큼 증가하는 고유 ID")
        void addMovies_AssignsIds() {
            // when
            Result<Set<Long>> result = catalog.addMovies(Set.of("Inception", "Memento"));

            // then
            assertThat(result.value()).containsExactlyInAnyOrder(1L, 2L);
            assertThat(catalog.sortedMovieIds()).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("영화 등록 실패 - 중복 제목은 ALREADY_EXISTS, ID 목록 변경 없음")
        void addMovies_Duplicate() {
            // given
            catalog.addMovies(Set.of("Inception", "Memento"));
            String moviesBefore = catalog.moviesSnapshot().text();

            // when
            Result<Set<Long>> result = catalog.addMovies(Set.of("Tenet", "Memento"));

            // then
            assertThat(result.error()).isEqualTo(ErrorCode.MOVIE_ALREADY_EXISTS);
            assertThat(result.error().getKind()).isEqualTo(ErrorKind.ALREADY_EXISTS);
            assertThat(catalog.sortedMovieIds()).containsExactly(1L, 2L);
            assertThat(catalog.moviesSnapshot().text()).isEqualTo(moviesBefore);
        }

        @Test
        @DisplayName("극장 등록 실패 - 중복 이름은 ALREADY_EXISTS, ID 목록 변경 없음")
        void addTheaters_Duplicate() {
            // given
            catalog.addTheaters(Set.of("CGV Gangnam"));

            // when
            Result<Set<Long>> result = catalog.addTheaters(Set.of("CGV Gangnam", "Megabox Coex"));

            // then
            assertThat(result.error()).isEqualTo(ErrorCode.THEATER_ALREADY_EXISTS);
            assertThat(catalog.sortedTheaterIds()).containsExactly(1L);
        }

        @Test
        @DisplayName("줄바꿈 하나 또는 빈 문자열이 든 이름도 등록 성공")
        void addMoviesAndTheaters_UnusualLabels() {
            // when
            Result<Set<Long>> movies = catalog.addMovies(Set.of("Part 1\nPart 2"));
            Result<Set<Long>> emptyTheater = catalog.addTheaters(Set.of(""));
            Result<Set<Long>> blankTheater = catalog.addTheaters(Set.of(" "));

            // then
            assertThat(movies.isSuccess()).isTrue();
            assertThat(emptyTheater.isSuccess()).isTrue();
            assertThat(blankTheater.isSuccess()).isTrue();
            assertThat(catalog.movieTitle(1L).value()).isEqualTo("Part 1\nPart 2");
            assertThat(catalog.theatersSnapshot().text()).isEqualTo("1,\r\n2, \r\n");
        }

        @Test
        @DisplayName("영화와 극장은 서로 독립적인 ID 공간을 가진다")
        void movieAndTheaterIdsAreIndependent() {
            assertThat(addMovie("Inception")).isEqualTo(1L);
            assertThat(addTheater("CGV Gangnam")).isEqualTo(1L);
        }

        @Test
        @DisplayName("영화 목록 스냅샷과 이름 조회")
        void moviesSnapshotAndTitles() {
            // given
            long movieId = addMovie("Inception");
            long theaterId = addTheater("CGV Gangnam");

            // then
            assertThat(catalog.moviesSnapshot().text()).isEqualTo("1,Inception\r\n");
            assertThat(catalog.theatersSnapshot().text()).isEqualTo("1,CGV Gangnam\r\n");
            assertThat(catalog.movieTitle(movieId).value()).isEqualTo("Inception");
            assertThat(catalog.theaterName(theaterId).value()).isEqualTo("CGV Gangnam");
            assertThat(catalog.movieTitle(99L).error()).isEqualTo(ErrorCode.MOVIE_NOT_FOUND);
            assertThat(catalog.theaterName(99L).error()).isEqualTo(ErrorCode.THEATER_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("상영 연결")
    class Screenings {

        @Test
        @DisplayName("새로 등록된 영화의 극장 목록은 비어 있다")
        void theatersForNewMovie_Empty() {
            long movieId = addMovie("Inception");

            assertThat(catalog.theatersForMovie(movieId).value().text()).isEmpty();
        }

        @Test
        @DisplayName("극장 연결 후 극장 목록은 ID 오름차순 'id,name' 줄")
        void addTheatersToMovie_RebuildsListing() {
            // given
            long movieId = addMovie("Inception");
            catalog.addTheaters(Set.of("CGV Gangnam"));
            catalog.addTheaters(Set.of("Megabox Coex"));
            catalog.addTheaters(Set.of("Lotte Cinema"));

            // when
            Result<Set<Long>> result = catalog.addTheatersToMovie(movieId, Set.of(3L, 1L));

            // then
            assertThat(result.value()).containsExactly(1L, 3L);
            assertThat(catalog.theatersForMovie(movieId).value().text())
                    .isEqualTo("1,CGV Gangnam\r\n3,Lotte Cinema\r\n");
        }

        @Test
        @DisplayName("연결된 상영의 좌석은 모두 예약 가능")
        void addTheatersToMovie_CreatesFreshInventory() {
            // given
            long movieId = addMovie("Inception");
            long theaterId = addTheater("CGV Gangnam");

            // when
            catalog.addTheatersToMovie(movieId, Set.of(theaterId));

            // then
            assertThat(catalog.availableSeats(movieId, theaterId).value().text()).isEqualTo(ALL_SEATS);
        }

        @Test
        @DisplayName("존재하지 않는 영화에 연결하면 MOVIE_NOT_FOUND")
        void addTheatersToMovie_UnknownMovie() {
            long theaterId = addTheater("CGV Gangnam");

            Result<Set<Long>> result = catalog.addTheatersToMovie(42L, Set.of(theaterId));

            assertThat(result.error()).isEqualTo(ErrorCode.MOVIE_NOT_FOUND);
        }

        @Test
        @DisplayName("등록되지 않은 극장이 섞이면 THEATER_NOT_FOUND, 변경 없음")
        void addTheatersToMovie_UnknownTheater() {
            // given
            long movieId = addMovie("Inception");
            long theaterId = addTheater("CGV Gangnam");

            // when
            Result<Set<Long>> result = catalog.addTheatersToMovie(movieId, Set.of(theaterId, 7L));

            // then
            assertThat(result.error()).isEqualTo(ErrorCode.THEATER_NOT_FOUND);
            assertThat(catalog.theatersForMovie(movieId).value().text()).isEmpty();
            assertThat(catalog.availableSeats(movieId, theaterId).error()).isEqualTo(ErrorCode.SCREENING_NOT_FOUND);
        }

        @Test
        @DisplayName("이미 연결된 극장이 섞이면 ALREADY_ASSOCIATED, 변경 없음")
        void addTheatersToMovie_AlreadyAssociated() {
            // given
            long movieId = addMovie("Inception");
            catalog.addTheaters(Set.of("CGV Gangnam"));
            catalog.addTheaters(Set.of("Megabox Coex"));
            catalog.addTheatersToMovie(movieId, Set.of(1L));
            catalog.book(movieId, 1L, Set.of(0));
            Snapshot listingBefore = catalog.theatersForMovie(movieId).value();

            // when
            Result<Set<Long>> result = catalog.addTheatersToMovie(movieId, Set.of(2L, 1L));

            // then
            assertThat(result.error()).isEqualTo(ErrorCode.THEATER_ALREADY_ASSOCIATED);
            assertThat(result.error().getKind()).isEqualTo(ErrorKind.ALREADY_ASSOCIATED);
            assertThat(catalog.theatersForMovie(movieId).value()).isSameAs(listingBefore);
            assertThat(catalog.availableSeats(movieId, 2L).isFailure()).isTrue();
            // 기존 인벤토리는 새로 만들어지지 않는다
            assertThat(catalog.availableSeats(movieId, 1L).value().text()).isEqualTo(seats(1, 19));
        }

        @Test
        @DisplayName("같은 극장을 여러 영화에 연결하면 상영마다 별도 인벤토리")
        void sameTheaterForTwoMovies_SeparateInventories() {
            // given
            long inception = addMovie("Inception");
            long memento = addMovie("Memento");
            long theaterId = addTheater("CGV Gangnam");
            catalog.addTheatersToMovie(inception, Set.of(theaterId));
            catalog.addTheatersToMovie(memento, Set.of(theaterId));

            // when
            catalog.book(inception, theaterId, Set.of(0, 1));

            // then
            assertThat(catalog.availableSeats(inception, theaterId).value().text()).isEqualTo(seats(2, 19));
            assertThat(catalog.availableSeats(memento, theaterId).value().text()).isEqualTo(ALL_SEATS);
        }

        @Test
        @DisplayName("존재하지 않는 영화의 극장 목록은 MOVIE_NOT_FOUND (빈 문자열이 아님)")
        void theatersForMovie_UnknownMovie() {
            Result<Snapshot> result = catalog.theatersForMovie(1L);

            assertThat(result.isFailure()).isTrue();
            assertThat(result.error()).isEqualTo(ErrorCode.MOVIE_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("좌석 예약")
    class Booking {

        private long movieId;
        private long theaterId;

        @BeforeEach
        void setUpScreening() {
            movieId = addMovie("Inception");
            theaterId = addTheater("CGV Gangnam");
            catalog.addTheatersToMovie(movieId, Set.of(theaterId));
        }

        @Test
        @DisplayName("예약 성공 후 남은 좌석 목록")
        void book_Accepted() {
            // when
            Result<BookingResult> result = catalog.book(movieId, theaterId, Set.of(0, 1, 2));

            // then
            assertThat(result.value()).isEqualTo(BookingResult.ACCEPTED);
            assertThat(catalog.availableSeats(movieId, theaterId).value().text()).isEqualTo(seats(3, 19));
        }

        @Test
        @DisplayName("이미 예약된 좌석을 다시 예약하면 NOT_AVAILABLE, 변경 없음")
        void book_NotAvailable() {
            // given
            catalog.book(movieId, theaterId, Set.of(0, 1, 2));

            // when
            Result<BookingResult> result = catalog.book(movieId, theaterId, Set.of(2, 3));

            // then
            assertThat(result.value()).isEqualTo(BookingResult.NOT_AVAILABLE);
            assertThat(catalog.availableSeats(movieId, theaterId).value().text()).isEqualTo(seats(3, 19));
        }

        @Test
        @DisplayName("범위를 벗어난 좌석은 INVALID, 변경 없음")
        void book_Invalid() {
            Result<BookingResult> result = catalog.book(movieId, theaterId, Set.of(25));

            assertThat(result.value()).isEqualTo(BookingResult.INVALID);
            assertThat(catalog.availableSeats(movieId, theaterId).value().text()).isEqualTo(ALL_SEATS);
        }

        @Test
        @DisplayName("상영이 없는 조합의 예약과 조회는 SCREENING_NOT_FOUND")
        void book_UnknownScreening() {
            long otherTheater = addTheater("Megabox Coex");

            assertThat(catalog.book(movieId, otherTheater, Set.of(0)).error())
                    .isEqualTo(ErrorCode.SCREENING_NOT_FOUND);
            assertThat(catalog.book(99L, theaterId, Set.of(0)).error())
                    .isEqualTo(ErrorCode.SCREENING_NOT_FOUND);
            assertThat(catalog.availableSeats(movieId, otherTheater).error())
                    .isEqualTo(ErrorCode.SCREENING_NOT_FOUND);
        }

        @Test
        @DisplayName("null 좌석 집합은 예외")
        void book_NullSeats() {
            assertThatThrownBy(() -> catalog.book(movieId, theaterId, null))
                    .isInstanceOf(BusinessException.class);
        }
    }

    @Nested
    @DisplayName("초기화")
    class Clear {

        @Test
        @DisplayName("초기화 후 모든 목록이 비고, ID는 1부터 다시 시작")
        void clear_ResetsEverything() {
            // given
            long movieId = addMovie("Inception");
            long theaterId = addTheater("CGV Gangnam");
            catalog.addTheatersToMovie(movieId, Set.of(theaterId));
            catalog.book(movieId, theaterId, Set.of(5));

            // when
            catalog.clear();

            // then
            assertThat(catalog.sortedMovieIds()).isEmpty();
            assertThat(catalog.sortedTheaterIds()).isEmpty();
            assertThat(catalog.moviesSnapshot().text()).isEmpty();
            assertThat(catalog.theatersForMovie(movieId).isFailure()).isTrue();
            assertThat(catalog.availableSeats(movieId, theaterId).isFailure()).isTrue();

            assertThat(catalog.addMovies(Set.of("Tenet")).value()).isEqualTo(Set.of(1L));
            assertThat(catalog.sortedMovieIds()).isEqualTo(List.of(1L));
        }

        @Test
        @DisplayName("초기화 후 같은 이름으로 다시 등록하면 새 인벤토리")
        void clear_ReRegisterGivesFreshInventory() {
            // given
            long movieId = addMovie("Inception");
            long theaterId = addTheater("CGV Gangnam");
            catalog.addTheatersToMovie(movieId, Set.of(theaterId));
            catalog.book(movieId, theaterId, Set.of(5));
            catalog.clear();

            // when
            long newMovieId = addMovie("Inception");
            long newTheaterId = addTheater("CGV Gangnam");
            catalog.addTheatersToMovie(newMovieId, Set.of(newTheaterId));

            // then
            assertThat(catalog.availableSeats(newMovieId, newTheaterId).value().text()).isEqualTo(ALL_SEATS);
        }
    }

    @Test
    @DisplayName("좌석 수 설정이 새 인벤토리에 적용된다")
    void customSeatCapacity() {
        BookingCatalog small = new BookingCatalog(3, false);
        long movieId = small.addMovies(Set.of("Inception")).value().iterator().next();
        long theaterId = small.addTheaters(Set.of("CGV Gangnam")).value().iterator().next();
        small.addTheatersToMovie(movieId, Set.of(theaterId));

        assertThat(small.seatCapacity()).isEqualTo(3);
        assertThat(small.availableSeats(movieId, theaterId).value().text()).isEqualTo("0,1,2\r\n");
        assertThat(small.book(movieId, theaterId, Set.of(3)).value()).isEqualTo(BookingResult.INVALID);
    }
}
