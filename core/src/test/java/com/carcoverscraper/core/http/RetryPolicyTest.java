package com.carcoverscraper.core.http;

import com.carcoverscraper.core.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void retries_onlyTransientKinds_andRespects_maxAttempts_3() {
        var p = new DefaultRetryPolicy();

        assertEquals(3, p.maxAttempts(), "maxAttempts must be 3");

        ErrorKind[] transients = {ErrorKind.TIMEOUT, ErrorKind.CONNECTION_RESET, ErrorKind.RATE_LIMITED,
                ErrorKind.SERVER_ERROR, ErrorKind.IO_ERROR, ErrorKind.CONNECTION_REFUSED};
        for (ErrorKind k : transients) {
            assertTrue(p.shouldRetry(1, k).retry(), "should retry after 1st failure for " + k);
            assertTrue(p.shouldRetry(2, k).retry(), "should retry after 2nd failure for " + k);
            assertFalse(p.shouldRetry(3, k).retry(), "must give up at attempt=3 for " + k);
        }

        ErrorKind[] permanents = {ErrorKind.NOT_FOUND, ErrorKind.GONE, ErrorKind.CLIENT_ERROR,
                ErrorKind.MALFORMED_URL, ErrorKind.DNS_FAILURE, ErrorKind.UNEXPECTED_STATUS, ErrorKind.CANCELLED};
        for (ErrorKind k : permanents) {
            assertFalse(p.shouldRetry(1, k).retry(), "must not retry permanent kind " + k);
        }
        assertFalse(p.shouldRetry(1, null).retry());
    }

    @Test
    void backoff_is_exponential_with_jitter_plus_minus_10_percent() {
        var p = new DefaultRetryPolicy(5, 500);

        // 500 → 1000 → 2000 (ms), 각각 ±10%
        assertBetween(p.nextDelay(1).toMillis(), 450, 550, "attempt=1 backoff");
        assertBetween(p.nextDelay(2).toMillis(), 900, 1100, "attempt=2 backoff");
        assertBetween(p.nextDelay(3).toMillis(), 1800, 2200, "attempt=3 backoff");
    }

    @Test
    void retryDecision_carries_backoff_delay() {
        var p = new DefaultRetryPolicy(3, 100);
        RetryDecision d = p.shouldRetry(2, ErrorKind.SERVER_ERROR);
        assertTrue(d.retry());
        assertBetween(d.delay().toMillis(), 180, 220, "delay after 2nd failure");
    }

    @Test
    void atLeast_raises_delay_to_server_floor_but_never_lowers_it() {
        RetryDecision d = RetryDecision.retry(Duration.ofMillis(500));
        assertEquals(Duration.ofSeconds(2), d.atLeast(Duration.ofSeconds(2)).delay());
        assertEquals(Duration.ofMillis(500), d.atLeast(Duration.ofMillis(100)).delay());
        assertFalse(RetryDecision.giveUp().atLeast(Duration.ofSeconds(5)).retry());
    }

    @Test
    void counting_decorator_counts_retries_and_giveUps() {
        var c = new CountingRetryPolicy(new DefaultRetryPolicy(2, 10));
        c.shouldRetry(1, ErrorKind.RATE_LIMITED);   // retry
        c.shouldRetry(2, ErrorKind.RATE_LIMITED);   // give up (ceiling)
        c.shouldRetry(1, ErrorKind.NOT_FOUND);      // give up (permanent)

        assertEquals(1, c.getRetryCount());
        assertEquals(2, c.getGiveUpCount());
        assertEquals(2, c.maxAttempts());
    }

    @Test
    void maxAttempts_below_one_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultRetryPolicy(0, 100));
    }

    // ---- helpers ----
    private static void assertBetween(long actual, long min, long max, String label) {
        assertTrue(actual >= min && actual <= max,
                () -> label + " out of range: " + actual + "ms (expected " + min + "~" + max + "ms)");
    }
}
