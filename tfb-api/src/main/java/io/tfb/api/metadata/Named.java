package io.tfb.api.metadata;

/**
 * Anything the toolset can list by name: frameworks, test implementations.
 */
public interface Named {

    /**
     * @return the display name of this entity
     */
    String name();
}
