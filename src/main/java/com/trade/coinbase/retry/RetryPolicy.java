package com.trade.coinbase.retry;

import com.trade.coinbase.exchange.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Instant retry of requests failing with the exchange's fake rate limit error.
 * <p>
 * Coinbase answers some transient server side errors with its rate limit status code.
 * Those are retried right away, without delay, up to {@code maxAttempts} calls.
 * Real throttling is the transport's limiter concern. Only remote failures
 * ({@link ExchangeException.ErrorCode#isRemote()}) whose text carries the instant retry
 * marker are retried; any other failure is rethrown unchanged on the spot.
 * Attempt state lives on the caller's stack, so one instance can be shared across threads.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final String DEFAULT_INSTANT_RETRY_MARKER = "429";

    private final String exchangeName;
    private final int maxAttempts;
    private final String instantRetryMarker;

    public RetryPolicy(String exchangeName) {
        this(exchangeName, DEFAULT_MAX_ATTEMPTS, DEFAULT_INSTANT_RETRY_MARKER);
    }

    public RetryPolicy(String exchangeName, int maxAttempts, String instantRetryMarker) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (instantRetryMarker == null || instantRetryMarker.isEmpty()) {
            throw new IllegalArgumentException("instantRetryMarker must not be empty");
        }
        this.exchangeName = exchangeName;
        this.maxAttempts = maxAttempts;
        this.instantRetryMarker = instantRetryMarker;
    }

    /**
     * Runs {@code call}, retrying it instantly while it fails with the instant retry marker.
     *
     * @param operation name of the wrapped operation, used in logs and in the final error
     * @param arguments arguments of the wrapped operation, used in logs and in the final error
     * @throws ExchangeException the original error when it is not instantly retryable, or a
     *                           {@code NETWORK_ERROR} chaining the last error once attempts are exhausted
     */
    public <T> T call(String operation, Object arguments, RemoteCall<T> call) throws ExchangeException {
        ExchangeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1 && Thread.currentThread().isInterrupted()) {
                throw new ExchangeException(ExchangeException.ErrorCode.CANCELLED,
                        "Interrupted while retrying " + operation + "(args=" + arguments + ")", lastError);
            }
            try {
                return call.execute();
            } catch (ExchangeException e) {
                if (!e.isRemote() || !isInstantRetryError(e)) {
                    throw e;
                }
                lastError = e;
                logger.debug("{} error on {}(args={}) request, retrying now. Attempt {} / {}, error: {} ({}).",
                        instantRetryMarker, operation, arguments, attempt, maxAttempts,
                        e.getMessage(), e.getErrorCode());
            }
        }
        throw new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR,
                "Failed " + exchangeName + " request after " + maxAttempts + " retries on " + operation
                        + "(args=" + arguments + ") due to " + instantRetryMarker + " error code. Last error: "
                        + lastError.getMessage() + " (" + lastError.getErrorCode() + ")",
                lastError);
    }

    public boolean isInstantRetryError(ExchangeException error) {
        String text = error.getMessage();
        return text != null && text.contains(instantRetryMarker);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public String getInstantRetryMarker() {
        return instantRetryMarker;
    }
}
