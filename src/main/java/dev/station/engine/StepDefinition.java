package dev.station.engine;

import dev.station.model.Link;
import dev.station.model.StepMetadata;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Registry entry for a step: its identifier, a factory producing a fresh
 * instance per invocation, and its static metadata.
 */
public record StepDefinition(
    String id,
    Supplier<? extends Step> factory,
    StepMetadata metadata
) {
    public StepDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id must not be empty");
        }
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(metadata, "metadata");
    }

    /** A step with metadata derived from its identifier. */
    public static StepDefinition of(String id, Supplier<? extends Step> factory) {
        return builder(id, factory).build();
    }

    public static Builder builder(String id, Supplier<? extends Step> factory) {
        return new Builder(id, factory);
    }

    public Step instantiate() {
        Step step = factory.get();
        if (step == null) {
            throw new IllegalStateException("Factory for step '" + id + "' returned null");
        }
        return step;
    }

    public static final class Builder {
        private final String id;
        private final Supplier<? extends Step> factory;
        private String displayName;
        private String description;
        private String image;
        private Link link;
        private boolean stopOnFail = StepMetadata.DEFAULT_STOP_ON_FAIL;

        private Builder(String id, Supplier<? extends Step> factory) {
            this.id = id;
            this.factory = factory;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder link(String url) {
            this.link = Link.of(url);
            return this;
        }

        public Builder link(String url, String text) {
            this.link = new Link(url, text);
            return this;
        }

        public Builder stopOnFail(boolean stopOnFail) {
            this.stopOnFail = stopOnFail;
            return this;
        }

        public StepDefinition build() {
            String name = displayName != null ? displayName : DisplayNames.fromIdentifier(id);
            return new StepDefinition(id, factory, new StepMetadata(name, description, image, link, stopOnFail));
        }
    }
}
