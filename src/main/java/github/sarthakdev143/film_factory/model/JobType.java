package github.sarthakdev143.film_factory.model;

import java.util.Locale;

public enum JobType {
    IMAGE(ResourceClass.IMAGE),
    CLIP(ResourceClass.VIDEO);

    private final ResourceClass resourceClass;

    JobType(ResourceClass resourceClass) {
        this.resourceClass = resourceClass;
    }

    public ResourceClass resourceClass() {
        return resourceClass;
    }

    public String toApiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
