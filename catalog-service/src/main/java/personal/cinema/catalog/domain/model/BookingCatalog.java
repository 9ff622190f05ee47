package personal.cinema.catalog.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.common.result.Result;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Booking Catalog
 * 영화/극장 식별자 카탈로그와 상영별 좌석 인벤토리를 소유하는 최상위 집합체
 *
 * 락 계층 (항상 바깥 -> 안쪽 순서로 획득):
 * 1. 카탈로그 락 - 조회와 좌석 예약은 읽기(공유), 영화/극장 등록과 clear()는 쓰기(배타)
 * 2. 인벤토리 락 - 좌석 목록 조회는 읽기, 좌석 예약은 쓰기
 *
 * 좌석 예약은 카탈로그 구조를 바꾸지 않으므로 카탈로그 락은 공유 모드로만 잡는다.
 * 서로 다른 상영의 예약은 완전히 병렬로, 같은 상영의 예약은 인벤토리 쓰기 락에서 직렬화된다.
 */
public class BookingCatalog {

    private final ReentrantReadWriteLock lock;
    private final int seatCapacity;
    private final boolean fairLocks;

    private final IdentifierCatalog movies = new IdentifierCatalog(EntryType.MOVIE);
    private final IdentifierCatalog theaters = new IdentifierCatalog(EntryType.THEATER);

    // movieId -> (theaterId -> SeatInventory), 극장 ID 오름차순
    private final Map<Long, Map<Long, SeatInventory>> screenings = new HashMap<>();

    // movieId -> "theaterId,theaterName" 목록
    private final Map<Long, Snapshot> theaterListings = new HashMap<>();

    public BookingCatalog() {
        this(SeatInventory.DEFAULT_CAPACITY, true);
    }

    public BookingCatalog(int seatCapacity, boolean fairLocks) {
        if (seatCapacity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Seat capacity must be positive: %d", seatCapacity));
        }
        this.lock = new ReentrantReadWriteLock(fairLocks);
        this.seatCapacity = seatCapacity;
        this.fairLocks = fairLocks;
    }

    // ========== 조회 (카탈로그 읽기 락) ==========

    /**
     * 영화 목록 (캐시)
     */
    public Snapshot moviesSnapshot() {
        return read(movies::snapshot);
    }

    /**
     * 극장 목록 (캐시)
     */
    public Snapshot theatersSnapshot() {
        return read(theaters::snapshot);
    }

    public List<Long> sortedMovieIds() {
        return read(movies::sortedIds);
    }

    public List<Long> sortedTheaterIds() {
        return read(theaters::sortedIds);
    }

    public Result<String> movieTitle(long movieId) {
        return read(() -> movies.getLabel(movieId));
    }

    public Result<String> theaterName(long theaterId) {
        return read(() -> theaters.getLabel(theaterId));
    }

    /**
     * 영화를 상영하는 극장 목록 (캐시)
     *
     * @return 극장 목록, 또는 영화가 없으면 MOVIE_NOT_FOUND
     */
    public Result<Snapshot> theatersForMovie(long movieId) {
        return read(() -> {
            Snapshot listing = theaterListings.get(movieId);
            if (listing == null) {
                return Result.failure(ErrorCode.MOVIE_NOT_FOUND);
            }
            return Result.success(listing);
        });
    }

    /**
     * 상영의 예약 가능 좌석 목록 (캐시)
     *
     * @return 좌석 목록, 또는 상영이 없으면 SCREENING_NOT_FOUND
     */
    public Result<Snapshot> availableSeats(long movieId, long theaterId) {
        return read(() -> {
            SeatInventory inventory = findInventory(movieId, theaterId);
            if (inventory == null) {
                return Result.failure(ErrorCode.SCREENING_NOT_FOUND);
            }
            return Result.success(inventory.snapshot());
        });
    }

    /**
     * 좌석 예약
     * 카탈로그 읽기 락 안에서 인벤토리를 찾고, 인벤토리 쓰기 락으로 예약한다.
     *
     * @return 예약 결과, 또는 상영이 없으면 SCREENING_NOT_FOUND
     */
    public Result<BookingResult> book(long movieId, long theaterId, Set<Integer> seats) {
        if (seats == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seats cannot be null");
        }
        return read(() -> {
            SeatInventory inventory = findInventory(movieId, theaterId);
            if (inventory == null) {
                return Result.failure(ErrorCode.SCREENING_NOT_FOUND);
            }
            return Result.success(inventory.book(seats));
        });
    }

    // ========== 구조 변경 (카탈로그 쓰기 락) ==========

    /**
     * 영화 일괄 등록
     * 새 영화마다 빈 상영 목록과 빈 극장 목록 캐시를 만든다.
     *
     * @return 부여된 영화 ID, 또는 MOVIE_ALREADY_EXISTS (변경 없음)
     */
    public Result<Set<Long>> addMovies(Set<String> titles) {
        return write(() -> {
            Result<Set<Long>> added = movies.add(titles);
            if (added.isSuccess()) {
                for (Long movieId : added.value()) {
                    screenings.put(movieId, new TreeMap<>());
                    rebuildTheaterListing(movieId);
                }
            }
            return added;
        });
    }

    /**
     * 극장 일괄 등록
     *
     * @return 부여된 극장 ID, 또는 THEATER_ALREADY_EXISTS (변경 없음)
     */
    public Result<Set<Long>> addTheaters(Set<String> names) {
        return write(() -> theaters.add(names));
    }

    /**
     * 영화에 극장 연결
     * 극장마다 모든 좌석이 비어 있는 새 인벤토리를 만든다.
     *
     * 검증 순서: 영화 존재 -> 극장 존재 -> 기존 연결 여부. 실패하면 아무것도 바뀌지 않는다.
     *
     * @return 연결된 극장 ID, 또는 MOVIE_NOT_FOUND / THEATER_NOT_FOUND / THEATER_ALREADY_ASSOCIATED
     */
    public Result<Set<Long>> addTheatersToMovie(long movieId, Set<Long> theaterIds) {
        if (theaterIds == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Theater IDs cannot be null");
        }
        return write(() -> {
            Map<Long, SeatInventory> rooms = screenings.get(movieId);
            if (rooms == null) {
                return Result.failure(ErrorCode.MOVIE_NOT_FOUND);
            }
            for (Long theaterId : theaterIds) {
                if (theaterId == null || !theaters.has(theaterId)) {
                    return Result.failure(ErrorCode.THEATER_NOT_FOUND);
                }
            }
            for (Long theaterId : theaterIds) {
                if (rooms.containsKey(theaterId)) {
                    return Result.failure(ErrorCode.THEATER_ALREADY_ASSOCIATED);
                }
            }

            for (Long theaterId : theaterIds) {
                rooms.put(theaterId, new SeatInventory(seatCapacity, fairLocks));
            }
            rebuildTheaterListing(movieId);
            return Result.success(Collections.unmodifiableSet(new TreeSet<>(theaterIds)));
        });
    }

    /**
     * 전체 초기화
     * 두 식별자 카탈로그, 모든 인벤토리와 캐시를 버린다.
     */
    public void clear() {
        write(() -> {
            movies.clear();
            theaters.clear();
            screenings.clear();
            theaterListings.clear();
            return null;
        });
    }

    public int seatCapacity() {
        return seatCapacity;
    }

    // ========== 내부 ==========

    // 카탈로그 락(읽기 또는 쓰기)을 잡은 상태에서만 호출
    private SeatInventory findInventory(long movieId, long theaterId) {
        Map<Long, SeatInventory> rooms = screenings.get(movieId);
        if (rooms == null) {
            return null;
        }
        return rooms.get(theaterId);
    }

    // 카탈로그 쓰기 락을 잡은 상태에서만 호출
    private void rebuildTheaterListing(long movieId) {
        StringBuilder sb = new StringBuilder();
        for (Long theaterId : screenings.get(movieId).keySet()) {
            sb.append(theaterId)
                    .append(',')
                    .append(theaters.getLabel(theaterId).orElseThrow())
                    .append(Snapshot.LINE_TERMINATOR);
        }
        Snapshot previous = theaterListings.getOrDefault(movieId, Snapshot.empty());
        theaterListings.put(movieId, previous.next(sb.toString()));
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
