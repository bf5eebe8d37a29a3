package github.sarthakdev143.film_factory.model;

/**
 * Class of external resource that shares one rate limiter.
 */
public enum ResourceClass {
    IMAGE,
    VIDEO
}
