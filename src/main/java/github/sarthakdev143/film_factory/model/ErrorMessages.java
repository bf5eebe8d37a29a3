package github.sarthakdev143.film_factory.model;

public final class ErrorMessages {

    public static final int MAX_LENGTH = 500;

    private ErrorMessages() {
    }

    public static String truncate(String message) {
        if (message == null) {
            return null;
        }
        String trimmed = message.trim();
        return trimmed.length() <= MAX_LENGTH ? trimmed : trimmed.substring(0, MAX_LENGTH);
    }

    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return truncate(message == null || message.isBlank() ? error.getClass().getSimpleName() : message);
    }
}
