package github.sarthakdev143.film_factory.retry;

/**
 * Failure of one external call, tagged by the adapter that produced it.
 */
public class ProviderCallException extends RuntimeException {

    private final ErrorKind kind;
    private final int statusCode;

    public ProviderCallException(String message, ErrorKind kind) {
        this(message, kind, 0, null);
    }

    public ProviderCallException(String message, ErrorKind kind, int statusCode) {
        this(message, kind, statusCode, null);
    }

    public ProviderCallException(String message, ErrorKind kind, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static ProviderCallException transientError(String message, Throwable cause) {
        return new ProviderCallException(message, ErrorKind.TRANSIENT, 0, cause);
    }

    public static ProviderCallException permanentError(String message, Throwable cause) {
        return new ProviderCallException(message, ErrorKind.PERMANENT, 0, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return kind == ErrorKind.TRANSIENT;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }
}
