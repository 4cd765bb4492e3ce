package com.event.reconciliation.feed;

import java.io.IOException;
import java.io.Reader;

/**
 * Opens the raw content of a feed; called once per read.
 */
@FunctionalInterface
public interface ReaderSource {
    Reader open() throws IOException;
}
