package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * RetryPolicy - 动作节点重试策略
 * <p>
 * 最大重试次数 0..10；初始延迟不能超过最大延迟。
 * 重试耗尽后按 {@link FailureEscalation} 决定动作进入 failed 还是 error。
 * </p>
 *
 * @author funcmodel
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryPolicy {

    public static final int MAX_RETRIES_LIMIT = 10;

    private static final RetryPolicy NONE =
            new RetryPolicy(0, BackoffStrategy.CONSTANT, 0L, 0L, FailureEscalation.FAILED);

    private final int maxRetries;
    private final BackoffStrategy backoff;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final FailureEscalation escalation;

    private RetryPolicy(int maxRetries, BackoffStrategy backoff, long initialDelayMs, long maxDelayMs,
                        FailureEscalation escalation) {
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.escalation = escalation;
    }

    public static Result<RetryPolicy> create(int maxRetries, BackoffStrategy backoff, long initialDelayMs,
                                             long maxDelayMs, FailureEscalation escalation) {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            return Result.fail("Max retries must be between 0 and " + MAX_RETRIES_LIMIT);
        }
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            return Result.fail("Retry delays must be non-negative");
        }
        if (initialDelayMs > maxDelayMs) {
            return Result.fail("Initial delay cannot exceed max delay");
        }
        return Result.ok(new RetryPolicy(maxRetries,
                backoff == null ? BackoffStrategy.CONSTANT : backoff,
                initialDelayMs, maxDelayMs,
                escalation == null ? FailureEscalation.FAILED : escalation));
    }

    public static Result<RetryPolicy> of(int maxRetries, BackoffStrategy backoff) {
        return create(maxRetries, backoff, 1000L, 30_000L, FailureEscalation.FAILED);
    }

    /**
     * 不重试，失败即终止
     */
    public static RetryPolicy none() {
        return NONE;
    }

    public boolean allowsRetry(int retryCount) {
        return retryCount < maxRetries;
    }

    /**
     * 第 attempt 次重试前应等待的毫秒数
     */
    public long calculateDelay(int attempt) {
        if (attempt <= 0) {
            return initialDelayMs;
        }
        switch (backoff) {
            case LINEAR:
                return Math.min(initialDelayMs * attempt, maxDelayMs);
            case EXPONENTIAL:
                double delay = initialDelayMs * Math.pow(2, attempt - 1);
                return (long) Math.min(delay, maxDelayMs);
            case CONSTANT:
            default:
                return initialDelayMs;
        }
    }
}
