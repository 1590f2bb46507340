package gamestream.adapter.out.http;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

import javax.net.ssl.SSLException;

import gamestream.config.GatewayConfig;

/**
 * Retry rules shared by every gateway call.
 *
 * <p>Only safe methods are retried, on transport failures and on the configured
 * statuses. The delay before retry {@code n} is {@code initialBackoff * 2^(n-1)},
 * which with the default of one second gives 1s, 2s, 4s.
 *
 * <p>TLS failures are never retried: a certificate problem does not go away on its own.
 */
public class GatewayRetryPolicy {

    static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final int maxRetries;
    private final Duration initialBackoff;
    private final Set<Integer> retryableStatuses;

    public GatewayRetryPolicy(int maxRetries, Duration initialBackoff, Set<Integer> retryableStatuses) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.retryableStatuses = Set.copyOf(retryableStatuses);
    }

    public static GatewayRetryPolicy from(GatewayConfig.Retry config) {
        return new GatewayRetryPolicy(config.maxRetries(), config.initialBackoff(), config.retryableStatuses());
    }

    public int maxRetries() {
        return maxRetries;
    }

    public boolean allowsRetry(String method) {
        return SAFE_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    public boolean hasRetriesLeft(int retriesDone) {
        return retriesDone < maxRetries;
    }

    public boolean isRetryable(String method, int statusCode) {
        return allowsRetry(method) && retryableStatuses.contains(statusCode);
    }

    public boolean isRetryable(String method, Throwable failure) {
        return allowsRetry(method) && !isTlsFailure(failure);
    }

    public boolean shouldRetry(String method, int retriesDone, int statusCode) {
        return hasRetriesLeft(retriesDone) && isRetryable(method, statusCode);
    }

    public boolean shouldRetry(String method, int retriesDone, Throwable failure) {
        return hasRetriesLeft(retriesDone) && isRetryable(method, failure);
    }

    /**
     * Delay before the given retry.
     *
     * @param retry retry number, starting at 1
     */
    public Duration backoff(int retry) {
        return initialBackoff.multipliedBy(1L << (retry - 1));
    }

    private static boolean isTlsFailure(Throwable failure) {
        for (var current = failure; current != null; current = current.getCause()) {
            if (current instanceof SSLException) {
                return true;
            }
        }
        return false;
    }
}
