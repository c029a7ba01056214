package io.tfb.api.metadata;

public record Framework(String name) implements Named {

    public Framework {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Framework name must not be blank");
        }
    }
}
