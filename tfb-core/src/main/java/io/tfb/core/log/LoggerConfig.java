package io.tfb.core.log;

import picocli.CommandLine.Help.Ansi;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Configuration for a {@link BenchmarkLogger}.
 * Everything is optional: the defaults give a console-only logger without prefix.
 */
public final class LoggerConfig {

    private String prefix = null;   // null = no console prefix
    private Path logDir = null;     // null = console only
    private boolean quiet = false;
    private Ansi ansi = Ansi.AUTO;
    private PrintStream console = System.out;

    private LoggerConfig() {}

    public static LoggerConfig create() {
        return new LoggerConfig();
    }

    public LoggerConfig prefix(String prefix) {
        if (prefix != null && prefix.isBlank()) {
            throw new IllegalArgumentException("Prefix must not be blank");
        }
        this.prefix = prefix;
        return this;
    }

    /**
     * Root directory for transcripts. Test sub-directories and the transcript file
     * are created beneath it on demand.
     */
    public LoggerConfig logDir(Path logDir) {
        this.logDir = logDir;
        return this;
    }

    public LoggerConfig logDir(String logDir) {
        return logDir(logDir == null ? null : Path.of(logDir));
    }

    /**
     * Suppress console output. A bound transcript keeps being written.
     */
    public LoggerConfig quiet(boolean quiet) {
        this.quiet = quiet;
        return this;
    }

    /**
     * Override color detection. {@link Ansi#AUTO} colors only when attached to a terminal.
     */
    public LoggerConfig ansi(Ansi ansi) {
        if (ansi == null) {
            throw new IllegalArgumentException("Ansi mode must not be null");
        }
        this.ansi = ansi;
        return this;
    }

    public LoggerConfig console(PrintStream console) {
        if (console == null) {
            throw new IllegalArgumentException("Console stream must not be null");
        }
        this.console = console;
        return this;
    }

    public String prefix() { return prefix; }
    public Path logDir() { return logDir; }
    public boolean quiet() { return quiet; }
    public Ansi ansi() { return ansi; }
    public PrintStream console() { return console; }
}
