package personal.cinema.catalog.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Snapshot (Value Object)
 * 미리 렌더링된 텍스트 목록 (불변)
 *
 * 변경이 일어날 때마다 version이 1 증가한 새 인스턴스로 교체되며,
 * 읽는 쪽은 복사 없이 같은 인스턴스를 공유한다.
 */
public record Snapshot(long version, String text) {

    /**
     * 모든 목록에서 사용하는 줄 끝 문자
     */
    public static final String LINE_TERMINATOR = "\r\n";

    public Snapshot {
        if (version < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Snapshot version cannot be negative: " + version);
        }
        if (text == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Snapshot text cannot be null");
        }
    }

    /**
     * 빈 목록 (최초 버전)
     */
    public static Snapshot empty() {
        return new Snapshot(0, "");
    }

    /**
     * 새 텍스트로 다음 버전 생성
     */
    public Snapshot next(String newText) {
        return new Snapshot(version + 1, newText);
    }
}
