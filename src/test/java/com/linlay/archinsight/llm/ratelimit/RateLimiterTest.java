package com.linlay.archinsight.llm.ratelimit;

import com.linlay.archinsight.runtime.CancellationToken;
import com.linlay.archinsight.runtime.MutableClock;
import com.linlay.archinsight.runtime.OrchestrationCancelledException;
import com.linlay.archinsight.runtime.RecordingSleeper;
import com.linlay.archinsight.runtime.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final MutableClock clock = new MutableClock(1_000_000L);
    private final RecordingSleeper sleeper = new RecordingSleeper(clock);

    @Test
    void windowShouldAdmitMaxRequestsThenBlockUntilOldestExpires() {
        RateLimiter limiter = new RateLimiter(clock, sleeper, Duration.ofMillis(100));
        limiter.configure("openai", new RateLimitConfig(2, Duration.ofSeconds(10)));

        limiter.recordRequest("openai");
        clock.advance(Duration.ofSeconds(1));
        limiter.recordRequest("openai");

        assertThat(limiter.canMakeRequest("openai")).isFalse();
        assertThat(limiter.getRequestCount("openai")).isEqualTo(2);

        clock.advance(Duration.ofMillis(8_999));
        assertThat(limiter.canMakeRequest("openai")).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(limiter.canMakeRequest("openai")).isTrue();
        assertThat(limiter.getRequestCount("openai")).isEqualTo(1);
    }

    @Test
    void waitUntilAvailableShouldSleepUntilOldestLeavesWindowPlusBuffer() {
        RateLimiter limiter = new RateLimiter(clock, sleeper, Duration.ofMillis(100));
        limiter.configure("claude", new RateLimitConfig(1, Duration.ofSeconds(60)));
        limiter.recordRequest("claude");
        clock.advance(Duration.ofSeconds(15));

        limiter.waitUntilAvailable("claude");

        assertThat(sleeper.sleepMillis()).containsExactly(45_100L);
        assertThat(limiter.canMakeRequest("claude")).isTrue();
    }

    @Test
    void waitUntilAvailableShouldReturnImmediatelyWhenSlotIsFree() {
        RateLimiter limiter = RateLimiter.withDefaults(clock, sleeper, RateLimiter.DEFAULT_BUFFER);

        limiter.waitUntilAvailable("openai");

        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void unconfiguredProviderShouldBeUnlimited() {
        RateLimiter limiter = new RateLimiter(clock, sleeper, Duration.ZERO);
        for (int i = 0; i < 1_000; i++) {
            limiter.recordRequest("gemini");
        }

        assertThat(limiter.canMakeRequest("gemini")).isTrue();
        assertThat(limiter.getRequestCount("gemini")).isZero();
        assertThat(limiter.retainedTimestamps("gemini")).isZero();
        limiter.waitUntilAvailable("gemini");
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void historyShouldStayBoundedByTheWindow() {
        RateLimiter limiter = new RateLimiter(clock, sleeper, Duration.ZERO);
        limiter.configure("openai", new RateLimitConfig(1_000, Duration.ofSeconds(1)));

        for (int i = 0; i < 10_000; i++) {
            limiter.recordRequest("openai");
            clock.advance(Duration.ofMillis(10));
        }

        assertThat(limiter.retainedTimestamps("openai")).isLessThanOrEqualTo(100);
    }

    @Test
    void acquireForUnconfiguredProviderShouldNotRetainHistory() {
        RateLimiter limiter = RateLimiter.withDefaults(clock, sleeper, Duration.ZERO);

        for (int i = 0; i < 500; i++) {
            limiter.acquire("gemini", CancellationToken.none());
        }

        assertThat(limiter.retainedTimestamps("gemini")).isZero();
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void defaultsShouldConfigureOpenAiAndClaude() {
        RateLimiter limiter = RateLimiter.withDefaults(clock, sleeper, RateLimiter.DEFAULT_BUFFER);

        assertThat(limiter.config("openai")).contains(RateLimitConfig.perMinute(60));
        assertThat(limiter.config("claude")).contains(RateLimitConfig.perMinute(50));
        assertThat(limiter.config("other")).isEmpty();
    }

    @Test
    void clearHistoryShouldResetOneOrAllProviders() {
        RateLimiter limiter = RateLimiter.withDefaults(clock, sleeper, RateLimiter.DEFAULT_BUFFER);
        limiter.recordRequest("openai");
        limiter.recordRequest("claude");

        limiter.clearHistory("openai");
        assertThat(limiter.getRequestCount("openai")).isZero();
        assertThat(limiter.getRequestCount("claude")).isEqualTo(1);

        limiter.clearHistory();
        assertThat(limiter.getRequestCount("claude")).isZero();
    }

    @Test
    void acquireShouldWaitAndRecordWhenWindowIsFull() {
        RateLimiter limiter = new RateLimiter(clock, sleeper, Duration.ofMillis(100));
        limiter.configure("openai", new RateLimitConfig(2, Duration.ofSeconds(1)));

        limiter.acquire("openai", CancellationToken.none());
        limiter.acquire("openai", CancellationToken.none());
        limiter.acquire("openai", CancellationToken.none());

        assertThat(sleeper.sleepMillis()).containsExactly(1_100L);
        assertThat(limiter.getRequestCount("openai")).isEqualTo(1);
    }

    @Test
    void acquireShouldStopWhenCancelledBeforeWaiting() {
        RateLimiter limiter = new RateLimiter(clock, sleeper, Duration.ofMillis(100));
        limiter.configure("openai", new RateLimitConfig(1, Duration.ofSeconds(1)));
        limiter.recordRequest("openai");
        CancellationToken token = CancellationToken.create();
        token.cancel("closing");

        assertThatThrownBy(() -> limiter.acquire("openai", token))
                .isInstanceOf(OrchestrationCancelledException.class);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void concurrentAcquireShouldAdmitExactlyTheLimit() throws Exception {
        Sleeper refusingSleeper = duration -> {
            throw new InterruptedException("no waiting in this test");
        };
        RateLimiter limiter = new RateLimiter(clock, refusingSleeper, Duration.ZERO);
        limiter.configure("openai", new RateLimitConfig(5, Duration.ofHours(1)));
        ExecutorService pool = Executors.newFixedThreadPool(12);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 12; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        limiter.acquire("openai", CancellationToken.create());
                        return true;
                    } catch (OrchestrationCancelledException ex) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }
        assertThat(limiter.getRequestCount("openai")).isEqualTo(5);
    }
}
