package io.tfb.core.log;

import io.tfb.api.log.LogBinding;
import io.tfb.api.metadata.Named;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes run output to the console and, once bound, to a plain-text transcript.
 * <p>
 * Console lines keep their colors and carry an optional bold {@code "<prefix>: "};
 * the transcript gets the same lines with ANSI escapes removed. Blank lines are
 * dropped from both.
 * <p>
 * Typical use during a run:
 * <pre>{@code
 * var logger = BenchmarkLogger.inDir(resultsDir);
 * logger.scopeToTest("gemini");          // results/<ts>/gemini, prefix "gemini"
 * logger.bindFile("benchmark.txt");      // results/<ts>/gemini/benchmark.txt
 * logger.writeLine("Building image");
 * }</pre>
 * Not thread safe. A transcript is never shared between loggers: a logger used by
 * another concurrent unit of work must be {@link #fork() forked} and bound again.
 */
public class BenchmarkLogger {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkLogger.class);

    private final PrintStream console;
    private final ConsoleStyle style;
    private String prefix;
    private Path logDir;
    private TranscriptFile transcript;
    private boolean quiet;

    public BenchmarkLogger(LoggerConfig config) {
        this.console = config.console();
        this.style = new ConsoleStyle(config.ansi());
        this.prefix = config.prefix();
        this.logDir = config.logDir();
        this.quiet = config.quiet();
    }

    /**
     * Console-only logger without prefix.
     */
    public static BenchmarkLogger standard() {
        return new BenchmarkLogger(LoggerConfig.create());
    }

    public static BenchmarkLogger withPrefix(String prefix) {
        return new BenchmarkLogger(LoggerConfig.create().prefix(prefix));
    }

    public static BenchmarkLogger inDir(Path logDir) {
        return new BenchmarkLogger(LoggerConfig.create().logDir(logDir));
    }

    public static BenchmarkLogger inDir(String logDir) {
        return inDir(Path.of(logDir));
    }

    public static BenchmarkLogger create(LoggerConfig config) {
        return new BenchmarkLogger(config);
    }

    /**
     * Point this logger at the given test: its name becomes the prefix and, when a
     * log directory is configured, {@code logDir/<test>} becomes the new log directory.
     * <p>
     * For example a log directory of {@code results/20200619191252} and test
     * {@code gemini} becomes {@code results/20200619191252/gemini}.
     * If the sub-directory cannot be created the log directory is left as it was.
     * The prefix is updated in every case except a blank test name, which changes nothing.
     */
    public LogBinding scopeToTest(String testName) {
        if (testName == null || testName.isBlank()) {
            log.warn("Ignoring blank test name, log directory stays {}", logDir);
            return LogBinding.skipped("blank test name");
        }
        LogBinding binding = rescope(testName);
        this.prefix = testName;
        return binding;
    }

    public LogBinding scopeToTest(Named test) {
        return scopeToTest(test.name());
    }

    private LogBinding rescope(String testName) {
        if (logDir == null) {
            return LogBinding.skipped("no log directory configured");
        }
        Path testDir = logDir.resolve(testName);
        try {
            Files.createDirectories(testDir);
        } catch (IOException e) {
            log.warn("Could not create log directory {}, keeping {}", testDir, logDir, e);
            return LogBinding.skipped("could not create " + testDir + ": " + e);
        }
        this.logDir = testDir;
        return LogBinding.applied();
    }

    /**
     * Bind the transcript to {@code logDir/<fileName>}, creating the file if needed.
     * Without a log directory this is a no-op; on failure the previous binding is kept.
     */
    public LogBinding bindFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            log.warn("Ignoring blank transcript file name");
            return LogBinding.skipped("blank file name");
        }
        if (logDir == null) {
            return LogBinding.skipped("no log directory configured");
        }
        Path file = logDir.resolve(fileName);
        try {
            this.transcript = TranscriptFile.open(file);
        } catch (IOException e) {
            log.warn("Could not create transcript {}, logging to console only", file, e);
            return LogBinding.skipped("could not create " + file + ": " + e);
        }
        log.debug("Transcript bound to {}", file);
        return LogBinding.applied();
    }

    /**
     * Write every non-blank line of {@code text} to the transcript (if bound) and
     * to the console (unless quiet).
     *
     * @throws IOException if the bound transcript cannot be opened or written
     */
    public void writeLine(Object text) throws IOException {
        for (String line : nonBlankLines(text)) {
            if (transcript != null) {
                transcript.append(line);
            }
            if (!quiet) {
                printLine(line);
            }
        }
    }

    /**
     * Same as {@link #writeLine(Object)} with the console text rendered red.
     */
    public void writeError(Object text) throws IOException {
        String red = nonBlankLines(text).stream()
                .map(line -> style.red(line.stripTrailing()))
                .collect(Collectors.joining("\n"));
        writeLine(red);
    }

    private void printLine(String line) {
        StringBuilder out = new StringBuilder();
        if (prefix != null) {
            out.append(style.bold(prefix)).append(": ");
        }
        out.append(line.stripTrailing()).append('\n');
        console.print(out);
        console.flush();
    }

    private static List<String> nonBlankLines(Object text) {
        return String.valueOf(text).lines()
                .filter(line -> !line.isBlank())
                .collect(Collectors.toList());
    }

    /**
     * Independent copy of this logger for another unit of work. The copy keeps the
     * prefix, log directory and console settings but has no transcript; bind one
     * with {@link #bindFile(String)} before writing to it.
     */
    public BenchmarkLogger fork() {
        LoggerConfig config = LoggerConfig.create()
                .prefix(prefix)
                .logDir(logDir)
                .quiet(quiet)
                .ansi(style.ansi())
                .console(console);
        return new BenchmarkLogger(config);
    }

    public ConsoleStyle style() {
        return style;
    }

    public Optional<String> prefix() {
        return Optional.ofNullable(prefix);
    }

    public Optional<Path> logDir() {
        return Optional.ofNullable(logDir);
    }

    public Optional<Path> logFile() {
        return Optional.ofNullable(transcript).map(TranscriptFile::path);
    }

    public boolean quiet() {
        return quiet;
    }

    public BenchmarkLogger quiet(boolean quiet) {
        this.quiet = quiet;
        return this;
    }
}
