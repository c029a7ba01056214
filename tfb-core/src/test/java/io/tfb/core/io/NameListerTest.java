package io.tfb.core.io;

import io.tfb.api.error.ToolsetException;
import io.tfb.api.metadata.BenchmarkTest;
import io.tfb.api.metadata.Framework;
import io.tfb.api.metadata.Metadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NameListerTest {

    private static final List<BenchmarkTest> TESTS = List.of(
            new BenchmarkTest("gemini", "gemini"),
            new BenchmarkTest("gemini-postgres", "gemini", List.of("broken")),
            new BenchmarkTest("undertow", "undertow"));

    private ByteArrayOutputStream out;
    private NameLister lister;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        lister = new NameLister(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return out.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    /** In-memory metadata over {@link #TESTS}. */
    private static final class FixedMetadata implements Metadata {

        @Override
        public List<Framework> listAllFrameworks() {
            return TESTS.stream().map(BenchmarkTest::framework).distinct().map(Framework::new).toList();
        }

        @Override
        public List<BenchmarkTest> listAllTests() {
            return TESTS;
        }

        @Override
        public List<BenchmarkTest> listTestsByTag(String tag) {
            return TESTS.stream().filter(test -> test.hasTag(tag)).toList();
        }

        @Override
        public List<BenchmarkTest> listTestsForFramework(String framework) {
            return TESTS.stream().filter(test -> test.framework().equals(framework)).toList();
        }
    }

    @Test
    void shouldPrintAllFrameworks() throws ToolsetException {
        lister.printAllFrameworks(new FixedMetadata());

        assertThat(printed()).isEqualTo("gemini\nundertow\n");
    }

    @Test
    void shouldPrintAllTestsInOrder() throws ToolsetException {
        lister.printAllTests(new FixedMetadata());

        assertThat(printed()).isEqualTo("gemini\ngemini-postgres\nundertow\n");
    }

    @Test
    void shouldPrintTestsWithTag() throws ToolsetException {
        lister.printAllTestsWithTag(new FixedMetadata(), "broken");

        assertThat(printed()).isEqualTo("gemini-postgres\n");
    }

    @Test
    void shouldPrintTestsForFramework() throws ToolsetException {
        lister.printAllTestsForFramework(new FixedMetadata(), "gemini");

        assertThat(printed()).isEqualTo("gemini\ngemini-postgres\n");
    }

    @Test
    void shouldPrintNothingForEmptyResult() throws ToolsetException {
        lister.printAllTestsWithTag(new FixedMetadata(), "missing");

        assertThat(printed()).isEmpty();
    }

    @Test
    void shouldPropagateQueryFailureUnchanged() {
        var failure = new ToolsetException("could not parse benchmark_config.json");

        assertThatThrownBy(() -> lister.printNames(() -> {
            throw failure;
        })).isSameAs(failure);
        assertThat(printed()).isEmpty();
    }
}
