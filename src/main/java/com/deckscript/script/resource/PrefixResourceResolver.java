package com.deckscript.script.resource;

/** Resolves relative paths by prefixing a fixed base locator. */
public final class PrefixResourceResolver implements ResourceResolver {

    public static final String DEFAULT_BASE = "chrome-extension://deckscript/";

    private final String base;

    public PrefixResourceResolver() {
        this(DEFAULT_BASE);
    }

    public PrefixResourceResolver(String base) {
        if (base == null || base.isEmpty()) throw new IllegalArgumentException("base is empty");
        this.base = base.endsWith("/") ? base : base + "/";
    }

    public String base() {
        return base;
    }

    @Override
    public String resolve(String relativePath) {
        String rel = (relativePath == null) ? "" : relativePath;
        while (rel.startsWith("/")) rel = rel.substring(1);
        return base + rel;
    }
}
