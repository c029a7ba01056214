package io.tfb.core.environment;

import io.tfb.api.environment.HostEnvironment;
import io.tfb.api.error.InvalidFrameworkBenchmarksDirException;
import io.tfb.api.error.ToolsetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Locates the FrameworkBenchmarks checkout and lays out the results directories of a run.
 * <p>
 * The checkout root is, in order: {@code $TFB_HOME}; {@code ~/.tfb} when it exists;
 * otherwise the working directory. Whichever is chosen must contain a
 * {@code frameworks} directory.
 */
public class ToolsetDirectories {

    private static final Logger log = LoggerFactory.getLogger(ToolsetDirectories.class);

    public static final String TFB_HOME = "TFB_HOME";
    static final String DOT_TFB = ".tfb";
    static final String FRAMEWORKS_DIR = "frameworks";
    static final String RESULTS_DIR = "results";
    private static final DateTimeFormatter RUN_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final HostEnvironment host;
    private final Clock clock;

    public ToolsetDirectories() {
        this(new SystemHostEnvironment(), Clock.systemUTC());
    }

    public ToolsetDirectories(HostEnvironment host, Clock clock) {
        this.host = host;
        this.clock = clock;
    }

    /**
     * @return the FrameworkBenchmarks root for this process
     * @throws InvalidFrameworkBenchmarksDirException if the resolved root has no frameworks directory
     */
    public Path tfbDirectory() throws InvalidFrameworkBenchmarksDirException {
        Path root = candidateRoot();
        if (!Files.isDirectory(root.resolve(FRAMEWORKS_DIR))) {
            throw new InvalidFrameworkBenchmarksDirException(root);
        }
        log.debug("Using FrameworkBenchmarks directory {}", root);
        return root;
    }

    private Path candidateRoot() {
        Optional<String> tfbHome = host.variable(TFB_HOME).filter(value -> !value.isBlank());
        if (tfbHome.isPresent()) {
            return Path.of(tfbHome.get());
        }
        Optional<Path> dotTfb = host.homeDirectory().map(home -> home.resolve(DOT_TFB));
        if (dotTfb.isPresent() && Files.exists(dotTfb.get())) {
            return dotTfb.get();
        }
        return host.workingDirectory()
                .or(() -> dotTfb)
                .orElse(Path.of(""));
    }

    /**
     * Create {@code base/results/<UTC yyyyMMddHHmmss>} for a new run.
     *
     * @return the created directory
     */
    public Path createResultsDirectory(Path base) throws ToolsetException {
        Path runDir = base.resolve(RESULTS_DIR).resolve(RUN_TIMESTAMP.format(clock.instant()));
        try {
            Files.createDirectories(runDir);
        } catch (IOException e) {
            throw new ToolsetException("Failed to create results directory " + runDir, e);
        }
        log.info("Results will be written to {}", runDir.toAbsolutePath());
        return runDir;
    }
}
