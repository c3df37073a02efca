package com.deckscript.script.resource;

/**
 * Maps an internal relative resource path ("icon/solid/star.svg") to the absolute locator the
 * host serves it under. The locator must carry the engine's resource scheme.
 */
@FunctionalInterface
public interface ResourceResolver {
    String resolve(String relativePath);
}
