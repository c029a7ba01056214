package io.tfb.core.io;

import io.tfb.api.error.ToolsetException;
import io.tfb.api.metadata.Named;

import java.util.List;

/**
 * A metadata lookup producing named entities, e.g. {@code metadata::listAllTests}.
 */
@FunctionalInterface
public interface ListingQuery<T extends Named> {

    List<T> list() throws ToolsetException;
}
