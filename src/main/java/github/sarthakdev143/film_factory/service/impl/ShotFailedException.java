package github.sarthakdev143.film_factory.service.impl;

class ShotFailedException extends RuntimeException {

    private final boolean keyframeGenerated;

    ShotFailedException(String message, boolean keyframeGenerated) {
        super(message);
        this.keyframeGenerated = keyframeGenerated;
    }

    boolean keyframeGenerated() {
        return keyframeGenerated;
    }
}
