package github.sarthakdev143.film_factory.model;

public record ProviderPrediction(State state, String outputUrl, String error) {

    public enum State {
        PENDING,
        COMPLETED,
        FAILED
    }

    public static ProviderPrediction pending() {
        return new ProviderPrediction(State.PENDING, null, null);
    }

    public static ProviderPrediction completed(String outputUrl) {
        return new ProviderPrediction(State.COMPLETED, outputUrl, null);
    }

    public static ProviderPrediction failed(String error) {
        return new ProviderPrediction(State.FAILED, null, error);
    }
}
