package alertengine.notify;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 指数退避: 第 n 次失败后等待 initial * 2^(n-1), 不超过 max
 */
@Getter
@ToString
public class RetryPolicy {
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("最大尝试次数至少为1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public Duration backoff(int failedAttempts) {
        if (failedAttempts <= 0) {
            return Duration.ZERO;
        }
        // 避免位移溢出
        int shift = Math.min(failedAttempts - 1, 30);
        Duration delay = initialBackoff.multipliedBy(1L << shift);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    public boolean exhausted(int attempts) {
        return attempts >= maxAttempts;
    }
}
