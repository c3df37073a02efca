package com.deckscript.script.resource;

import java.io.IOException;

/** Loads the bytes behind an absolute resource locator. */
@FunctionalInterface
public interface ResourceFetcher {
    FetchedResource fetch(String locator) throws IOException;
}
