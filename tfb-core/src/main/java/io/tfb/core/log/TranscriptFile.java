package io.tfb.core.log;

import org.jline.utils.AttributedString;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Append-only plain-text copy of everything a logger writes.
 * <p>
 * A transcript belongs to exactly one logger: {@link BenchmarkLogger#fork()} never
 * copies it, so a forked logger has to bind its own file.
 */
public final class TranscriptFile {

    private final Path path;

    private TranscriptFile(Path path) {
        this.path = path;
    }

    /**
     * Open the transcript at {@code path}, creating an empty file if none exists.
     * An existing file is kept as is and appended to.
     */
    public static TranscriptFile open(Path path) throws IOException {
        if (!Files.exists(path)) {
            Files.createFile(path);
        } else if (!Files.isRegularFile(path)) {
            throw new IOException("Transcript path is not a regular file: " + path);
        }
        return new TranscriptFile(path);
    }

    public Path path() {
        return path;
    }

    /**
     * Strip ANSI escapes from {@code line} and append it followed by a newline.
     * The file is opened for each call and never created here: a transcript
     * deleted after binding surfaces as an {@link IOException}.
     */
    public void append(String line) throws IOException {
        String plain = strip(line).stripTrailing();
        Files.writeString(path, plain + "\n", StandardCharsets.UTF_8,
                StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    static String strip(String text) {
        return AttributedString.stripAnsi(text);
    }
}
