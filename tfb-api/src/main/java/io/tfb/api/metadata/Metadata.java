package io.tfb.api.metadata;

import io.tfb.api.error.ToolsetException;

import java.util.List;

/**
 * Read access to the framework and test definitions of a FrameworkBenchmarks checkout.
 * Implementations walk the frameworks directory and parse the test configs.
 */
public interface Metadata {

    List<Framework> listAllFrameworks() throws ToolsetException;

    List<BenchmarkTest> listAllTests() throws ToolsetException;

    /**
     * @param tag tag to filter on
     * @return tests carrying the given tag, in discovery order
     */
    List<BenchmarkTest> listTestsByTag(String tag) throws ToolsetException;

    /**
     * @param framework framework name
     * @return every test implementation of the given framework, in discovery order
     */
    List<BenchmarkTest> listTestsForFramework(String framework) throws ToolsetException;
}
