package personal.cinema.catalog.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Seat Inventory
 * 하나의 (영화, 극장) 상영에 대한 고정 크기 좌석 상태
 *
 * 좌석은 AVAILABLE -> BOOKED 로 한 번만 바뀌고 되돌아가지 않는다 (취소 없음).
 * 조회는 읽기 락, 예약은 쓰기 락으로 보호한다.
 */
public class SeatInventory {

    public static final int DEFAULT_CAPACITY = 20;

    private final ReentrantReadWriteLock lock;
    private final boolean[] available;
    private int availableCount;
    private volatile Snapshot snapshot = Snapshot.empty();

    public SeatInventory() {
        this(DEFAULT_CAPACITY, true);
    }

    public SeatInventory(int capacity, boolean fairLock) {
        if (capacity < 1) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Seat capacity must be positive: %d", capacity));
        }
        this.lock = new ReentrantReadWriteLock(fairLock);
        this.available = new boolean[capacity];
        Arrays.fill(available, true);
        this.availableCount = capacity;
        rebuildSnapshot();
    }

    /**
     * 예약 가능한 좌석 목록 (캐시)
     * 오름차순, 쉼표 구분, 줄 끝 문자로 끝남. 남은 좌석이 없으면 줄 끝 문자만 있다.
     */
    public Snapshot snapshot() {
        lock.readLock().lock();
        try {
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 좌석 일괄 예약 (원자적)
     *
     * 1단계: 모든 번호의 범위 검증 (하나라도 벗어나면 INVALID)
     * 2단계: 모든 좌석의 예약 가능 여부 검증 (하나라도 예약됨이면 NOT_AVAILABLE)
     * 3단계: 커밋 및 스냅샷 재생성
     *
     * 범위 검증이 먼저이므로 범위 밖 번호와 이미 예약된 번호가 섞이면 INVALID.
     * 빈 요청도 INVALID.
     *
     * @param seats 예약할 좌석 번호 집합
     * @return 처리 결과
     */
    public BookingResult book(Set<Integer> seats) {
        if (seats == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seats cannot be null");
        }
        if (seats.isEmpty()) {
            return BookingResult.INVALID;
        }

        lock.writeLock().lock();
        try {
            for (Integer seat : seats) {
                if (!isInRange(seat)) {
                    return BookingResult.INVALID;
                }
            }
            for (Integer seat : seats) {
                if (!available[seat]) {
                    return BookingResult.NOT_AVAILABLE;
                }
            }
            for (Integer seat : seats) {
                available[seat] = false;
            }
            availableCount -= seats.size();
            rebuildSnapshot();
            return BookingResult.ACCEPTED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 예약 가능한 좌석 번호 목록 (오름차순)
     */
    public List<Integer> availableSeats() {
        lock.readLock().lock();
        try {
            List<Integer> seats = new ArrayList<>(availableCount);
            for (int idx = 0; idx < available.length; idx++) {
                if (available[idx]) {
                    seats.add(idx);
                }
            }
            return seats;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int availableCount() {
        lock.readLock().lock();
        try {
            return availableCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return available.length;
    }

    private boolean isInRange(Integer seat) {
        return seat != null && seat >= 0 && seat < available.length;
    }

    // 쓰기 락을 잡은 상태(또는 생성자)에서만 호출
    private void rebuildSnapshot() {
        StringBuilder sb = new StringBuilder();
        for (int idx = 0; idx < available.length; idx++) {
            if (available[idx]) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(idx);
            }
        }
        sb.append(Snapshot.LINE_TERMINATOR);
        snapshot = snapshot.next(sb.toString());
    }
}
