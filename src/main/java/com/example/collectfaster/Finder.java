package com.example.collectfaster;

import java.io.IOException;
import java.util.stream.Stream;

@FunctionalInterface
public interface Finder {
    /**
     * Lists every file to collect. The returned stream is lazy and may be consumed once.
     */
    Stream<FoundFile> list() throws IOException;
}
