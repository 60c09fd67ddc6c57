package com.example.tracepipeline.notification;

import com.example.tracepipeline.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryWebhookRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-15T10:59:00Z"));
    private final InMemoryWebhookRateLimiter limiter = new InMemoryWebhookRateLimiter(clock);

    @Test
    void testLimitPerHourBucket() {
        assertThat(limiter.tryAcquire("wh1", 2)).isTrue();
        assertThat(limiter.tryAcquire("wh1", 2)).isTrue();
        assertThat(limiter.tryAcquire("wh1", 2)).isFalse();
        assertThat(limiter.tryAcquire("wh2", 2)).isTrue();

        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.tryAcquire("wh1", 2)).isTrue();
    }

    @Test
    void testStaleBucketsDroppedOnRollover() {
        limiter.tryAcquire("wh1", 5);
        limiter.tryAcquire("wh2", 5);
        limiter.tryAcquire("wh1", 5);
        assertThat(limiter.trackedBuckets()).isEqualTo(2);

        clock.advance(Duration.ofMinutes(1));
        limiter.tryAcquire("wh3", 5);
        assertThat(limiter.trackedBuckets()).isEqualTo(1);
    }

    @Test
    void testReleaseReturnsSlot() {
        assertThat(limiter.tryAcquire("wh1", 1)).isTrue();
        assertThat(limiter.tryAcquire("wh1", 1)).isFalse();

        limiter.release("wh1");
        assertThat(limiter.tryAcquire("wh1", 1)).isTrue();
    }

    @Test
    void testReleaseWithoutReservation() {
        limiter.release("wh1");

        assertThat(limiter.tryAcquire("wh1", 1)).isTrue();
        assertThat(limiter.tryAcquire("wh1", 1)).isFalse();
    }

    @Test
    void testUnlimited() {
        for (int i = 0; i < 100; i++) {
            assertThat(limiter.tryAcquire("wh1", null)).isTrue();
            assertThat(limiter.tryAcquire("wh1", 0)).isTrue();
        }
    }

    @Test
    void testHourBucketFormat() {
        assertThat(InMemoryWebhookRateLimiter.HOUR_BUCKET.format(clock.instant())).isEqualTo("2024031510");
    }
}
