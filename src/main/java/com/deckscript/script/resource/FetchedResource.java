package com.deckscript.script.resource;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** Bytes plus content type, as returned by a {@link ResourceFetcher}. */
public final class FetchedResource {
    private final byte[] bytes;
    private final String contentType;

    public FetchedResource(byte[] bytes, String contentType) {
        if (bytes == null) throw new IllegalArgumentException("bytes is null");
        this.bytes = bytes.clone();
        this.contentType = (contentType == null || contentType.isEmpty()) ? "application/octet-stream" : contentType;
    }

    public byte[] bytes() { return bytes.clone(); }
    public String contentType() { return contentType; }

    public boolean isSvg() {
        return contentType.contains("image/svg");
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public String toDataUrl() {
        return "data:" + contentType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }
}
