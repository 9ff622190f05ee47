package personal.cinema.common.exception;

/**
 * 에러 코드 정의
 * 에러 분류(ErrorKind)와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(ErrorKind.INVALID, "C001", "잘못된 입력값입니다."),

    // Catalog Domain (Mxxx / Txxx)
    MOVIE_NOT_FOUND(ErrorKind.NOT_FOUND, "M001", "영화를 찾을 수 없습니다."),
    MOVIE_ALREADY_EXISTS(ErrorKind.ALREADY_EXISTS, "M002", "이미 등록된 영화입니다."),
    THEATER_NOT_FOUND(ErrorKind.NOT_FOUND, "T001", "극장을 찾을 수 없습니다."),
    THEATER_ALREADY_EXISTS(ErrorKind.ALREADY_EXISTS, "T002", "이미 등록된 극장입니다."),
    THEATER_ALREADY_ASSOCIATED(ErrorKind.ALREADY_ASSOCIATED, "T003", "이미 영화를 상영 중인 극장입니다."),

    // Booking Domain (Bxxx)
    SCREENING_NOT_FOUND(ErrorKind.NOT_FOUND, "B001", "해당 영화와 극장의 상영 정보를 찾을 수 없습니다."),
    SEAT_INVALID(ErrorKind.INVALID, "B002", "유효하지 않은 좌석 번호입니다."),
    SEAT_NOT_AVAILABLE(ErrorKind.NOT_AVAILABLE, "B003", "예약 불가능한 좌석입니다.");

    private final ErrorKind kind;
    private final String code;
    private final String message;

    ErrorCode(ErrorKind kind, String code, String message) {
        this.kind = kind;
        this.code = code;
        this.message = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
