package com.linlay.archinsight.runtime;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void throwIfCancelledShouldReportReasonAndLocation() {
        CancellationToken token = CancellationToken.create();
        token.throwIfCancelled("first call");

        token.cancel("user closed the panel");

        assertThat(token.isCancelled()).isTrue();
        assertThatThrownBy(() -> token.throwIfCancelled("generation call 2"))
                .isInstanceOf(OrchestrationCancelledException.class)
                .hasMessage("Cancelled before generation call 2: user closed the panel");
    }

    @Test
    void firstCancelReasonShouldWin() {
        CancellationToken token = CancellationToken.create();
        token.cancel("first");
        token.cancel("second");

        assertThatThrownBy(() -> token.throwIfCancelled("x")).hasMessageEndingWith(": first");
    }

    @Test
    void sharedNoneTokenShouldRejectCancel() {
        assertThat(CancellationToken.none().isCancelled()).isFalse();
        assertThatThrownBy(() -> CancellationToken.none().cancel("nope"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void sleepShouldSkipSleeperWhenAlreadyCancelled() {
        RecordingSleeper sleeper = new RecordingSleeper();
        CancellationToken token = CancellationToken.create();
        token.cancel("stop");

        assertThatThrownBy(() -> token.sleep(sleeper, Duration.ofSeconds(1), "backoff"))
                .isInstanceOf(OrchestrationCancelledException.class);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void interruptedSleepShouldBecomeCancellationAndRestoreFlag() {
        Sleeper interrupted = duration -> {
            throw new InterruptedException("boom");
        };
        try {
            assertThatThrownBy(() -> CancellationToken.create().sleep(interrupted, Duration.ofMillis(5), "backoff"))
                    .isInstanceOf(OrchestrationCancelledException.class)
                    .hasMessage("Interrupted during backoff")
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
