package github.sarthakdev143.film_factory.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * Runs one external call with a per-attempt timeout and exponential backoff between transient
 * failures. It never changes job state; the last error is thrown to the caller.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final ExecutorService attemptExecutor;
    private final Predicate<Throwable> transientClassifier;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryExecutor(ExecutorService attemptExecutor, Predicate<Throwable> transientClassifier) {
        this(attemptExecutor, transientClassifier, Sleeper.SYSTEM, () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryExecutor(
            ExecutorService attemptExecutor,
            Predicate<Throwable> transientClassifier,
            Sleeper sleeper,
            DoubleSupplier random) {
        this.attemptExecutor = attemptExecutor;
        this.transientClassifier = transientClassifier;
        this.sleeper = sleeper;
        this.random = random;
    }

    public <T> T run(Callable<T> call, RetryPolicy policy) {
        return run("external call", call, policy);
    }

    public <T> T run(String operation, Callable<T> call, RetryPolicy policy) {
        ProviderCallException lastError = null;

        for (int attempt = 0; attempt < policy.maxAttempts(); attempt++) {
            try {
                return runAttempt(call, policy);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw ProviderCallException.permanentError(operation + " was interrupted", e);
            } catch (Exception e) {
                lastError = classify(operation, e, policy);
            }

            if (!lastError.isTransient()) {
                logger.warn("{} failed with a permanent error on attempt {}: {}",
                        operation, attempt + 1, lastError.getMessage());
                throw lastError;
            }

            if (attempt + 1 < policy.maxAttempts()) {
                Duration delay = delayFor(policy, attempt);
                logger.info("{} attempt {}/{} failed transiently, retrying in {} ms: {}",
                        operation, attempt + 1, policy.maxAttempts(), delay.toMillis(), lastError.getMessage());
                pause(operation, delay);
            }
        }

        logger.warn("{} gave up after {} attempt(s): {}", operation, policy.maxAttempts(), lastError.getMessage());
        throw lastError;
    }

    Duration delayFor(RetryPolicy policy, int attempt) {
        Duration backoff = policy.backoffFor(attempt);
        long jitterMillis = Math.round(backoff.toMillis() * policy.jitterRatio() * random.getAsDouble());
        return backoff.plusMillis(Math.max(0, jitterMillis));
    }

    private <T> T runAttempt(Callable<T> call, RetryPolicy policy) throws Exception {
        if (!policy.hasTimeout()) {
            return call.call();
        }

        Future<T> future = attemptExecutor.submit(call);
        try {
            return future.get(policy.perCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    private ProviderCallException classify(String operation, Exception error, RetryPolicy policy) {
        if (error instanceof ProviderCallException providerError) {
            return providerError;
        }
        if (error instanceof TimeoutException || error instanceof CancellationException) {
            return ProviderCallException.transientError(
                    operation + " timed out after " + policy.perCallTimeout().toMillis() + " ms",
                    error);
        }

        ErrorKind kind = transientClassifier.test(error) ? ErrorKind.TRANSIENT : ErrorKind.PERMANENT;
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new ProviderCallException(message, kind, 0, error);
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ProviderCallException.permanentError(operation + " was interrupted during backoff", e);
        }
    }
}
