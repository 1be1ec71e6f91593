package com.pocket.remote;

import com.pocket.exception.RemoteAuthException;
import com.pocket.exception.RemoteNetworkException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryPolicy 测试")
class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private RetryPolicy.RetryPolicyBuilder recording() {
        return RetryPolicy.builder().sleeper(sleeps::add);
    }

    @Test
    @DisplayName("网络错误按指数退避重试直到成功")
    void retriesNetworkErrors() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = recording().build();

        String result = policy.execute("flaky", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new RemoteNetworkException("connection reset");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    @DisplayName("超过最大次数后抛出最后一次的错误")
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = recording().build();

        assertThatThrownBy(() -> policy.execute("down", () -> {
            calls.incrementAndGet();
            throw new RemoteNetworkException("timeout " + calls.get());
        })).isInstanceOf(RemoteNetworkException.class).hasMessage("timeout 3");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("认证错误不重试")
    void authErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = recording().build();

        assertThatThrownBy(() -> policy.execute("auth", () -> {
            calls.incrementAndGet();
            throw new RemoteAuthException("bad token");
        })).isInstanceOf(RemoteAuthException.class);
        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("退避时间不超过上限")
    void delayIsCapped() {
        RetryPolicy policy = recording().maxAttempts(5)
                .initialDelay(Duration.ofSeconds(1)).maxDelay(Duration.ofSeconds(2)).build();

        assertThatThrownBy(() -> policy.execute("slow", () -> {
            throw new RemoteNetworkException("busy");
        })).isInstanceOf(RemoteNetworkException.class);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2),
                Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("none 只尝试一次")
    void none_singleAttempt() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> RetryPolicy.none().execute("once", () -> {
            calls.incrementAndGet();
            throw new RemoteNetworkException("nope");
        })).isInstanceOf(RemoteNetworkException.class);
        assertThat(calls).hasValue(1);
    }
}
