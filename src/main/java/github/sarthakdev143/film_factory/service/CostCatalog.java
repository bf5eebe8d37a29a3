package github.sarthakdev143.film_factory.service;

/**
 * USD prices used for film cost counters.
 */
public record CostCatalog(double imagePerUnit, double videoPerSecond) {

    public double imageCost() {
        return imagePerUnit;
    }

    public double videoCost(int durationSeconds) {
        return videoPerSecond * durationSeconds;
    }
}
