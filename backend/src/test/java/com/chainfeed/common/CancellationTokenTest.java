package com.chainfeed.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void sleep_notCancelled_returnsTrueAfterDuration() {
        CancellationToken token = new CancellationToken();
        assertThat(token.sleep(Duration.ofMillis(20))).isTrue();
        assertThat(token.isCancelled()).isFalse();
    }

    @Test
    void sleep_cancelledWhileWaiting_returnsFalseEarly() throws Exception {
        CancellationToken token = new CancellationToken();
        CountDownLatch sleeping = new CountDownLatch(1);
        AtomicBoolean result = new AtomicBoolean(true);
        Thread sleeper = new Thread(() -> {
            sleeping.countDown();
            result.set(token.sleep(Duration.ofSeconds(30)));
        });
        sleeper.start();
        assertThat(sleeping.await(1, TimeUnit.SECONDS)).isTrue();

        token.cancel();
        sleeper.join(5_000);

        assertThat(sleeper.isAlive()).isFalse();
        assertThat(result.get()).isFalse();
    }

    @Test
    void cancel_runsCallbacksOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void onCancel_alreadyCancelled_runsImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicBoolean ran = new AtomicBoolean();

        token.onCancel(() -> ran.set(true));

        assertThat(ran.get()).isTrue();
        assertThat(token.sleep(Duration.ofSeconds(10))).isFalse();
    }
}
