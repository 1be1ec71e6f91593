package com.pocket.remote;

import com.pocket.exception.RemoteException;
import com.pocket.exception.RemoteNetworkException;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 远端调用的重试策略：指数退避，只重试 {@link RemoteNetworkException}，
 * 认证失败、被拒绝等其它远端错误立即抛出。
 */
@Value
@Builder
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @Builder.Default
    int maxAttempts = 3;
    @Builder.Default
    Duration initialDelay = Duration.ofMillis(200);
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(2);
    @Builder.Default
    Sleeper sleeper = d -> Thread.sleep(d.toMillis());

    /** 一次远端调用。 */
    @FunctionalInterface
    public interface RemoteCall<T> {
        T call() throws RemoteException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /** 不重试，测试中使用。 */
    public static RetryPolicy none() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    public <T> T execute(String operation, RemoteCall<T> call) throws RemoteException {
        Duration delay = initialDelay;
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (RemoteNetworkException e) {
                if (attempt >= attempts) {
                    log.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}): {}, retrying in {} ms",
                        operation, attempt, attempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RemoteNetworkException(operation + " interrupted", ie);
                }
                Duration doubled = delay.multipliedBy(2);
                delay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
            }
        }
    }
}
