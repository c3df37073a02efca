package com.deckscript.script.resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Serves locators under a base prefix from the class path.
 *
 * {@code chrome-extension://deckscript/icon/solid/square.svg?color=FF0000} is read from
 * {@code deck-resources/icon/solid/square.svg}. The query part is ignored; paths climbing out of
 * the root with ".." are refused.
 */
public final class ClasspathResourceFetcher implements ResourceFetcher {

    public static final String DEFAULT_ROOT = "deck-resources/";

    private final String base;
    private final String root;
    private final ClassLoader loader;

    public ClasspathResourceFetcher() {
        this(PrefixResourceResolver.DEFAULT_BASE, DEFAULT_ROOT);
    }

    public ClasspathResourceFetcher(String base, String root) {
        this.base = base;
        this.root = root.endsWith("/") ? root : root + "/";
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        this.loader = (cl != null) ? cl : ClasspathResourceFetcher.class.getClassLoader();
    }

    @Override
    public FetchedResource fetch(String locator) throws IOException {
        if (locator == null || !locator.startsWith(base)) {
            throw new FileNotFoundException("Not an internal resource: " + locator);
        }
        String path = locator.substring(base.length());
        int q = path.indexOf('?');
        if (q >= 0) path = path.substring(0, q);
        int h = path.indexOf('#');
        if (h >= 0) path = path.substring(0, h);
        for (String segment : path.split("/")) {
            if (segment.equals("..")) throw new FileNotFoundException("Invalid resource path: " + path);
        }

        try (InputStream in = loader.getResourceAsStream(root + path)) {
            if (in == null) throw new FileNotFoundException("Resource not found: " + path);
            return new FetchedResource(in.readAllBytes(), contentTypeFor(path));
        }
    }

    static String contentTypeFor(String path) {
        String p = path.toLowerCase(Locale.ROOT);
        if (p.endsWith(".svg")) return "image/svg+xml";
        if (p.endsWith(".png")) return "image/png";
        if (p.endsWith(".jpg") || p.endsWith(".jpeg")) return "image/jpeg";
        if (p.endsWith(".gif")) return "image/gif";
        if (p.endsWith(".webp")) return "image/webp";
        return "application/octet-stream";
    }
}
