package personal.cinema.catalog.application.port.in;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.util.Set;

/**
 * Register Labels Command
 * 영화 제목 또는 극장 이름 일괄 등록 커맨드
 */
public record RegisterLabelsCommand(Set<String> labels) {

    public RegisterLabelsCommand {
        if (labels == null || labels.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Labels cannot be null or empty");
        }
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "Label cannot be null or blank");
            }
        }
        labels = Set.copyOf(labels);
    }

    public static RegisterLabelsCommand of(String... labels) {
        return new RegisterLabelsCommand(Set.of(labels));
    }
}
