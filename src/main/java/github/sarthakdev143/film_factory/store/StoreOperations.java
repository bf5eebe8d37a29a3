package github.sarthakdev143.film_factory.store;

import github.sarthakdev143.film_factory.retry.ProviderCallException;
import github.sarthakdev143.film_factory.retry.RetryExecutor;
import github.sarthakdev143.film_factory.retry.RetryPolicy;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs each store operation in its own transaction, retried as a whole when the database is
 * briefly unavailable.
 */
public class StoreOperations {

    private final TransactionTemplate transactionTemplate;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    public StoreOperations(TransactionTemplate transactionTemplate, RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        this.transactionTemplate = transactionTemplate;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
    }

    public <T> T inTransaction(String operation, Supplier<T> work) {
        return retried(operation, () -> transactionTemplate.execute(status -> work.get()));
    }

    /**
     * Retries {@code work} without opening a transaction; the caller manages its own.
     */
    public <T> T retried(String operation, Supplier<T> work) {
        try {
            return retryExecutor.run(operation, work::get, retryPolicy);
        } catch (ProviderCallException e) {
            // Callers see the store's own exception, not the retry wrapper.
            if (e.getCause() instanceof RuntimeException cause && !(cause instanceof ProviderCallException)) {
                throw cause;
            }
            throw e;
        }
    }

    public TransactionTemplate transactionTemplate() {
        return transactionTemplate;
    }
}
