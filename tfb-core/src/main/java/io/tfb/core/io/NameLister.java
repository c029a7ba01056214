package io.tfb.core.io;

import io.tfb.api.error.ToolsetException;
import io.tfb.api.metadata.Metadata;
import io.tfb.api.metadata.Named;

import java.io.PrintStream;

/**
 * Prints the names of frameworks and tests, one per line, for the listing commands.
 * Output is plain console text; nothing is written to a transcript.
 */
public class NameLister {

    private final PrintStream out;

    public NameLister() {
        this(System.out);
    }

    public NameLister(PrintStream out) {
        this.out = out;
    }

    public void printAllFrameworks(Metadata metadata) throws ToolsetException {
        printNames(metadata::listAllFrameworks);
    }

    public void printAllTests(Metadata metadata) throws ToolsetException {
        printNames(metadata::listAllTests);
    }

    public void printAllTestsWithTag(Metadata metadata, String tag) throws ToolsetException {
        printNames(() -> metadata.listTestsByTag(tag));
    }

    public void printAllTestsForFramework(Metadata metadata, String framework) throws ToolsetException {
        printNames(() -> metadata.listTestsForFramework(framework));
    }

    /**
     * Run the query and print each entity's name. A failing query prints nothing
     * and its exception is rethrown as is.
     */
    public <T extends Named> void printNames(ListingQuery<T> query) throws ToolsetException {
        for (T entity : query.list()) {
            out.println(entity.name());
        }
        out.flush();
    }
}
