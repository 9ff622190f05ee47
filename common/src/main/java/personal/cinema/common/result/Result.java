package personal.cinema.common.result;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.util.function.Function;

/**
 * 처리 결과 (Value Object)
 * 성공 값 또는 에러 코드 중 하나만 가지는 불변 객체
 *
 * 조회 실패, 중복 등록 같은 예상 가능한 실패는 예외 대신 이 타입으로 반환한다.
 *
 * @param value 성공 값 (실패 시 null)
 * @param error 에러 코드 (성공 시 null)
 * @param <T>   성공 값 타입
 */
public record Result<T>(T value, ErrorCode error) {

    public Result {
        if ((value == null) == (error == null)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Result must hold exactly one of value or error");
        }
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null);
    }

    public static <T> Result<T> failure(ErrorCode error) {
        return new Result<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * 성공 값을 변환 (실패는 그대로 전달)
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    /**
     * 성공 값 반환, 실패 시 BusinessException
     */
    public T orElseThrow() {
        if (isFailure()) {
            throw new BusinessException(error);
        }
        return value;
    }
}
