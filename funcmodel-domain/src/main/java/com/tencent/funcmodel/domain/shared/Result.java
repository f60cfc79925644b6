package com.tencent.funcmodel.domain.shared;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Result - 领域操作结果
 * <p>
 * 所有领域规则违例都以失败的 Result 返回，而不是抛出异常。
 * 调用方必须先判断 {@link #isSuccess()}，再访问 {@link #getValue()} 或 {@link #getError()}；
 * 访问错误的一侧属于编程错误，会直接抛出 {@link IllegalStateException}。
 * </p>
 *
 * @param <T> 成功时携带的值类型
 * @author funcmodel
 */
public final class Result<T> {

    private final boolean success;
    private final T value;
    private final String error;
    private final ErrorType errorType;

    private Result(boolean success, T value, String error, ErrorType errorType) {
        this.success = success;
        this.value = value;
        this.error = error;
        this.errorType = errorType;
    }

    public static <T> Result<T> ok(T value) {
        return new Result<>(true, value, null, null);
    }

    public static Result<Void> ok() {
        return new Result<>(true, null, null, null);
    }

    public static <T> Result<T> fail(String error) {
        return fail(ErrorType.VALIDATION, error);
    }

    public static <T> Result<T> fail(ErrorType errorType, String error) {
        Objects.requireNonNull(errorType, "errorType");
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("A failed result needs an error message");
        }
        return new Result<>(false, null, error, errorType);
    }

    public static <T> Result<T> notFound(String error) {
        return fail(ErrorType.NOT_FOUND, error);
    }

    public static <T> Result<T> conflict(String error) {
        return fail(ErrorType.CONFLICT, error);
    }

    public static <T> Result<T> accessDenied(String error) {
        return fail(ErrorType.ACCESS_DENIED, error);
    }

    /**
     * 返回第一个失败的结果；全部成功时返回成功
     */
    public static Result<Void> combine(Result<?>... results) {
        for (Result<?> result : results) {
            if (result.isFailure()) {
                return result.propagate();
            }
        }
        return ok();
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public T getValue() {
        if (!success) {
            throw new IllegalStateException("Cannot get the value of a failed result: " + error);
        }
        return value;
    }

    public String getError() {
        if (success) {
            throw new IllegalStateException("Cannot get the error of a successful result");
        }
        return error;
    }

    public ErrorType getErrorType() {
        if (success) {
            throw new IllegalStateException("Cannot get the error type of a successful result");
        }
        return errorType;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (!success) {
            return propagate();
        }
        return ok(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (!success) {
            return propagate();
        }
        return Objects.requireNonNull(mapper.apply(value), "flatMap mapper returned null");
    }

    public <U> U fold(Function<? super T, ? extends U> onSuccess, Function<String, ? extends U> onFailure) {
        return success ? onSuccess.apply(value) : onFailure.apply(error);
    }

    public Result<T> recover(Function<String, ? extends T> recovery) {
        if (success) {
            return this;
        }
        return ok(recovery.apply(error));
    }

    public Result<T> onSuccess(Consumer<? super T> action) {
        if (success) {
            action.accept(value);
        }
        return this;
    }

    public Result<T> onFailure(Consumer<String> action) {
        if (!success) {
            action.accept(error);
        }
        return this;
    }

    public T orElse(T other) {
        return success ? value : other;
    }

    public T orElseGet(Supplier<? extends T> other) {
        return success ? value : other.get();
    }

    /**
     * 丢弃成功值，只保留成败信息
     */
    public Result<Void> toVoid() {
        return success ? ok() : propagate();
    }

    /**
     * 以新的值类型转发失败，保持原错误信息与分类
     */
    @SuppressWarnings("unchecked")
    public <U> Result<U> propagate() {
        if (success) {
            throw new IllegalStateException("Only failed results can be propagated");
        }
        return (Result<U>) this;
    }

    @Override
    public String toString() {
        return success
                ? "Result.ok(" + value + ")"
                : "Result.fail(" + errorType + ": " + error + ")";
    }
}
