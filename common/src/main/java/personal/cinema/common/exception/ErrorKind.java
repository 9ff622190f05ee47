package personal.cinema.common.exception;

/**
 * 에러 분류
 * 카탈로그가 돌려주는 실패 결과의 종류 (전송 계층 상태 코드와 무관)
 */
public enum ErrorKind {
    /**
     * 존재하지 않는 영화/극장 또는 상영 조합
     */
    NOT_FOUND,

    /**
     * 이미 등록된 이름
     */
    ALREADY_EXISTS,

    /**
     * 이미 영화에 연결된 극장
     */
    ALREADY_ASSOCIATED,

    /**
     * 잘못된 입력 (범위를 벗어난 좌석 번호 등)
     */
    INVALID,

    /**
     * 이미 예약된 좌석
     */
    NOT_AVAILABLE
}
