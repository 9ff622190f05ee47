package personal.cinema.catalog.domain.model;

import personal.cinema.common.exception.ErrorCode;

/**
 * Booking Result Enum
 * 좌석 예약 요청의 처리 결과
 */
public enum BookingResult {
    /**
     * 요청한 모든 좌석이 예약됨
     */
    ACCEPTED(null),

    /**
     * 요청한 좌석 중 하나 이상이 이미 예약됨 (아무것도 예약되지 않음)
     */
    NOT_AVAILABLE(ErrorCode.SEAT_NOT_AVAILABLE),

    /**
     * 요청한 좌석 중 하나 이상이 범위를 벗어남 (아무것도 예약되지 않음)
     */
    INVALID(ErrorCode.SEAT_INVALID);

    private final ErrorCode errorCode;

    BookingResult(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }

    /**
     * 거절 사유에 해당하는 에러 코드 (ACCEPTED는 null)
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
