package github.sarthakdev143.film_factory.retry;

import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Decides whether an untyped failure is worth retrying. Typed {@link ProviderCallException}s are
 * classified by their own kind before this predicate is consulted.
 */
public class TransientErrorClassifier implements Predicate<Throwable> {

    public static final List<String> DEFAULT_MARKERS = List.of(
            "429",
            "502",
            "503",
            "504",
            "unavailable",
            "resource_exhausted",
            "rate limit",
            "too many requests",
            "timed out",
            "connection reset");

    private final List<String> markers;
    private final List<Class<? extends Throwable>> transientTypes;

    public TransientErrorClassifier(List<String> markers, List<Class<? extends Throwable>> transientTypes) {
        this.markers = markers == null
                ? List.of()
                : markers.stream().map(marker -> marker.toLowerCase(Locale.ROOT)).toList();
        this.transientTypes = transientTypes == null ? List.of() : List.copyOf(transientTypes);
    }

    public static TransientErrorClassifier defaults() {
        return new TransientErrorClassifier(
                DEFAULT_MARKERS,
                List.of(ConnectException.class, InterruptedIOException.class));
    }

    public TransientErrorClassifier withTransientTypes(List<Class<? extends Throwable>> extraTypes) {
        List<Class<? extends Throwable>> combined = new ArrayList<>(transientTypes);
        combined.addAll(extraTypes);
        return new TransientErrorClassifier(markers, combined);
    }

    @Override
    public boolean test(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof ProviderCallException providerError) {
                return providerError.isTransient();
            }
            for (Class<? extends Throwable> type : transientTypes) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            if (matchesMarker(current.getMessage())) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private boolean matchesMarker(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return markers.stream().anyMatch(normalized::contains);
    }
}
