package io.tfb.api.environment;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Process-level lookups the toolset depends on.
 * Swapped for a fixed implementation in tests so the real environment is never touched.
 */
public interface HostEnvironment {

    /**
     * @param name environment variable name
     * @return the variable's value, empty if unset
     */
    Optional<String> variable(String name);

    /**
     * @return the current user's home directory, if known
     */
    Optional<Path> homeDirectory();

    /**
     * @return the process working directory, if known
     */
    Optional<Path> workingDirectory();
}
