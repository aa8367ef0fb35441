package io.github.samzhu.relay.service;

import java.time.Duration;
import java.util.Set;

import io.github.resilience4j.core.IntervalFunction;
import io.github.samzhu.relay.config.GeminiProperties;
import io.github.samzhu.relay.exception.UpstreamException;

/**
 * 上游重試策略
 *
 * <p>退避時間為 {@code min(base * 2^attempt, max)}，attempt 從 0 起算；
 * 狀態碼重試與網路重試各自計數，但共用同一個上限與退避函式。
 *
 * @see GeminiUpstreamClient
 */
public class UpstreamRetryPolicy {

    private static final double MULTIPLIER = 2.0;

    private final int maxRetries;
    private final Set<Integer> retryableStatusCodes;
    private final IntervalFunction backoff;
    private final Sleeper sleeper;

    public UpstreamRetryPolicy(int maxRetries, Set<Integer> retryableStatusCodes,
                               Duration backoffBase, Duration backoffMax, Sleeper sleeper) {
        this.maxRetries = maxRetries;
        this.retryableStatusCodes = Set.copyOf(retryableStatusCodes);
        this.backoff = IntervalFunction.ofExponentialBackoff(
            backoffBase.toMillis(), MULTIPLIER, backoffMax.toMillis());
        this.sleeper = sleeper;
    }

    public static UpstreamRetryPolicy from(GeminiProperties properties) {
        return from(properties, Sleeper.THREAD);
    }

    public static UpstreamRetryPolicy from(GeminiProperties properties, Sleeper sleeper) {
        return new UpstreamRetryPolicy(properties.maxRetries(), properties.retryableStatusCodes(),
            properties.backoffBase(), properties.backoffMax(), sleeper);
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public boolean isRetryable(int status) {
        return retryableStatusCodes.contains(status);
    }

    /**
     * 第 {@code attempt} 次重試前的等待時間（attempt 從 0 起算）
     */
    public Duration delayFor(int attempt) {
        return Duration.ofMillis(backoff.apply(attempt + 1));
    }

    /**
     * 依退避時間等待，執行緒被中斷時恢復中斷旗標並結束重試
     *
     * @throws UpstreamException 等待期間被中斷
     */
    public void pause(int attempt) {
        try {
            sleeper.sleep(delayFor(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw UpstreamException.forNetwork(e);
        }
    }

    /**
     * 等待策略，測試時可替換為不實際等待的實作
     */
    @FunctionalInterface
    public interface Sleeper {

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
