package gamestream.adapter.out.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.Set;

import javax.net.ssl.SSLHandshakeException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GatewayRetryPolicy")
class GatewayRetryPolicyTest {

    private final GatewayRetryPolicy policy =
            new GatewayRetryPolicy(3, Duration.ofSeconds(1), Set.of(500, 502, 503, 504));

    @Nested
    @DisplayName("methods")
    class Methods {

        @Test
        @DisplayName("should allow retries for safe methods only")
        void shouldAllowSafeMethods() {
            assertTrue(policy.allowsRetry("GET"));
            assertTrue(policy.allowsRetry("head"));
            assertTrue(policy.allowsRetry("OPTIONS"));
            assertFalse(policy.allowsRetry("POST"));
            assertFalse(policy.allowsRetry("PUT"));
            assertFalse(policy.allowsRetry("DELETE"));
        }

        @Test
        @DisplayName("should never retry POST, even on a retryable status")
        void shouldNotRetryPost() {
            assertFalse(policy.shouldRetry("POST", 0, 503));
            assertFalse(policy.shouldRetry("POST", 0, new ConnectException("refused")));
        }
    }

    @Nested
    @DisplayName("statuses")
    class Statuses {

        @Test
        @DisplayName("should retry configured statuses")
        void shouldRetryConfiguredStatuses() {
            assertTrue(policy.shouldRetry("GET", 0, 500));
            assertTrue(policy.shouldRetry("GET", 0, 503));
        }

        @Test
        @DisplayName("should not retry success or client errors")
        void shouldNotRetryOtherStatuses() {
            assertFalse(policy.shouldRetry("GET", 0, 200));
            assertFalse(policy.shouldRetry("GET", 0, 404));
            assertFalse(policy.shouldRetry("GET", 0, 501));
        }

        @Test
        @DisplayName("should judge a status independently of the retry budget")
        void shouldJudgeStatusWithoutBudget() {
            assertTrue(policy.isRetryable("GET", 504));
            assertFalse(policy.isRetryable("POST", 504));
            assertTrue(policy.hasRetriesLeft(2));
            assertFalse(policy.hasRetriesLeft(3));
        }

        @Test
        @DisplayName("should stop after the maximum number of retries")
        void shouldStopAfterMaxRetries() {
            assertTrue(policy.shouldRetry("GET", 2, 503));
            assertFalse(policy.shouldRetry("GET", 3, 503));
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should retry connection failures")
        void shouldRetryConnectionFailures() {
            assertTrue(policy.shouldRetry("GET", 0, new ConnectException("refused")));
            assertTrue(policy.shouldRetry("GET", 1, new IOException("Connection reset")));
        }

        @Test
        @DisplayName("should not retry TLS failures")
        void shouldNotRetryTlsFailures() {
            var failure = new IOException("handshake", new SSLHandshakeException("bad certificate"));

            assertFalse(policy.shouldRetry("GET", 0, failure));
        }
    }

    @Test
    @DisplayName("should double the backoff for each retry")
    void shouldBackOffExponentially() {
        assertEquals(Duration.ofSeconds(1), policy.backoff(1));
        assertEquals(Duration.ofSeconds(2), policy.backoff(2));
        assertEquals(Duration.ofSeconds(4), policy.backoff(3));
    }

    @Test
    @DisplayName("should reject a negative retry count")
    void shouldRejectNegativeRetries() {
        assertThrows(IllegalArgumentException.class, () -> new GatewayRetryPolicy(-1, Duration.ZERO, Set.of()));
    }
}
