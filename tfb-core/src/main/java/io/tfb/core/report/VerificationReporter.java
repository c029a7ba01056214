package io.tfb.core.report;

import io.micrometer.core.instrument.MeterRegistry;
import io.tfb.api.verification.Verification;
import io.tfb.api.verification.VerificationMessage;
import io.tfb.core.log.BenchmarkLogger;
import io.tfb.core.log.ConsoleStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Renders the verification summary printed at the end of a verify run.
 * <p>
 * Output, one line per verified type:
 * <pre>
 * ===============================================================================
 * Verification Summary
 * -------------------------------------------------------------------------------
 * | gemini
 * |       json         : PASS
 * |       plaintext    : ERROR - timeout
 * ===============================================================================
 * </pre>
 * Only the first error (or warning) of an outcome is shown; the full detail is in
 * the per-test transcript written during verification.
 */
public class VerificationReporter {

    private static final Logger log = LoggerFactory.getLogger(VerificationReporter.class);

    public static final String SUMMARY_FILE = "benchmark.txt";
    static final String TITLE = "Verification Summary";
    static final int WIDTH = 79;
    private static final int GUTTER_WIDTH = 8;
    private static final int TYPE_WIDTH = 13;
    private static final int STATUS_WIDTH = 5;

    private final VerificationMetrics metrics;

    public VerificationReporter() {
        this(new VerificationMetrics());
    }

    public VerificationReporter(MeterRegistry registry) {
        this(new VerificationMetrics(registry));
    }

    public VerificationReporter(VerificationMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Write the summary through a fork of {@code logger} bound to {@value #SUMMARY_FILE}
     * in the logger's current log directory. The caller's logger is left untouched.
     *
     * @throws IOException if writing to the console or the summary transcript fails;
     *                     rendering stops at the first failure
     */
    public void report(List<Verification> verifications, BenchmarkLogger logger) throws IOException {
        BenchmarkLogger summary = logger.fork();
        summary.bindFile(SUMMARY_FILE);

        Map<String, List<Verification>> frameworks = VerificationGrouping.byFramework(verifications);
        log.debug("Reporting {} verifications across {} frameworks", verifications.size(), frameworks.size());

        ConsoleStyle style = summary.style();
        String border = "=".repeat(WIDTH);
        summary.writeLine(style.cyan(border));
        summary.writeLine(style.cyan(TITLE));
        summary.writeLine(style.cyan("-".repeat(WIDTH)));

        for (Map.Entry<String, List<Verification>> framework : frameworks.entrySet()) {
            summary.writeLine(style.cyan("|") + " " + style.cyan(framework.getKey()));
            for (Verification verification : framework.getValue()) {
                summary.writeLine(formatLine(verification, style));
                metrics.record(verification);
            }
        }
        summary.writeLine(style.cyan(border));
    }

    static String formatLine(Verification verification, ConsoleStyle style) {
        String head = style.cyan(pad("|", GUTTER_WIDTH))
                + style.cyan(pad(verification.typeName(), TYPE_WIDTH))
                + ": ";
        String message = verification.firstMessage()
                .map(VerificationMessage::shortMessage)
                .orElse("");
        return switch (verification.status()) {
            case ERROR -> head + style.red(pad("ERROR", STATUS_WIDTH)) + " - " + message;
            case WARN -> head + style.yellow(pad("WARN", STATUS_WIDTH)) + " - " + message;
            case PASS -> head + style.green("PASS");
        };
    }

    private static String pad(String text, int width) {
        return String.format("%-" + width + "s", text);
    }

    public VerificationMetrics metrics() {
        return metrics;
    }
}
