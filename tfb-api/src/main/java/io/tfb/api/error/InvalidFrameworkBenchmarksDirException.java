package io.tfb.api.error;

import java.nio.file.Path;

/**
 * The resolved FrameworkBenchmarks root has no {@code frameworks} directory.
 */
public class InvalidFrameworkBenchmarksDirException extends ToolsetException {

    private final Path directory;

    public InvalidFrameworkBenchmarksDirException(Path directory) {
        super("Not a FrameworkBenchmarks directory (no 'frameworks' sub-directory): "
                + directory.toAbsolutePath());
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }
}
