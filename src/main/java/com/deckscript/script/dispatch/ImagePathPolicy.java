package com.deckscript.script.dispatch;

import java.util.regex.Pattern;

import com.deckscript.script.resource.IconLoader;
import com.deckscript.script.resource.ResourceResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Decides where slide.addImage may read from.
 *
 * Scheme-less paths are resolved as internal resources. After that only data:, blob: and the
 * internal resource scheme are accepted; internal images go through the icon loader so that
 * tinted SVG icons arrive as data URLs.
 */
public final class ImagePathPolicy {

    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.\\-]*:");

    private final ResourceResolver resolver;
    private final String resourceScheme;
    private final IconLoader icons;

    public ImagePathPolicy(ResourceResolver resolver, String resourceScheme, IconLoader icons) {
        if (resourceScheme == null || resourceScheme.isEmpty()) throw new IllegalArgumentException("resourceScheme is empty");
        this.resolver = resolver;
        this.resourceScheme = resourceScheme;
        this.icons = icons;
    }

    /** Rewrites {@code opts.path} in place; throws when the path points outside the allowed schemes. */
    public void apply(ObjectNode opts) {
        JsonNode pathNode = opts.get("path");
        if (pathNode == null || !pathNode.isTextual()) return;

        String path = pathNode.asText();
        if (!HAS_SCHEME.matcher(path).find() && resolver != null) {
            path = resolver.resolve(path);
        }
        if (!isAllowed(path)) {
            throw new IllegalArgumentException("External image paths are not allowed");
        }
        if (path.startsWith(resourceScheme) && icons != null) {
            String inlined = icons.retint(path);
            if (inlined != null) path = inlined;
        }
        opts.put("path", path);
    }

    public boolean isAllowed(String path) {
        return path.startsWith("data:") || path.startsWith("blob:") || path.startsWith(resourceScheme);
    }
}
