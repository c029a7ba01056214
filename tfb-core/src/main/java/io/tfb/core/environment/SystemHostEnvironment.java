package io.tfb.core.environment;

import io.tfb.api.environment.HostEnvironment;

import java.nio.file.Path;
import java.util.Optional;

/**
 * {@link HostEnvironment} backed by the running JVM.
 */
public class SystemHostEnvironment implements HostEnvironment {

    @Override
    public Optional<String> variable(String name) {
        return Optional.ofNullable(System.getenv(name));
    }

    @Override
    public Optional<Path> homeDirectory() {
        return Optional.ofNullable(System.getProperty("user.home")).map(Path::of);
    }

    @Override
    public Optional<Path> workingDirectory() {
        return Optional.ofNullable(System.getProperty("user.dir")).map(Path::of);
    }
}
