package com.deckscript.script.resource;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.deckscript.debug.Debug;
import com.deckscript.script.dispatch.Colors;

/**
 * Loads internal icons and turns them into data URLs.
 *
 * An icon path may carry a {@code color} query parameter ({@code icon/solid/star.svg?color=FF0000});
 * SVG icons then get that color as the {@code fill} of their root element. A color that is not a
 * recognizable color string is ignored and the icon is left untinted. Results are cached per path
 * and color, up to {@link #MAX_CACHED_ICONS} entries. When an icon cannot be loaded the fallback
 * icon is used instead.
 */
public final class IconLoader {

    private static final String TAG = "IconLoader";

    public static final int MAX_CACHED_ICONS = 256;

    private final ResourceResolver resolver;
    private final ResourceFetcher fetcher;
    private final String fallbackIconPath;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public IconLoader(ResourceResolver resolver, ResourceFetcher fetcher, String fallbackIconPath) {
        if (resolver == null) throw new IllegalArgumentException("resolver is null");
        if (fetcher == null) throw new IllegalArgumentException("fetcher is null");
        this.resolver = resolver;
        this.fetcher = fetcher;
        this.fallbackIconPath = fallbackIconPath;
    }

    /**
     * Data URL for a relative icon path with optional query. Falls back to the fallback icon, and
     * as a last resort to the fallback icon's resolved locator.
     */
    public String inlineIcon(String relativeWithQuery) {
        String path = stripQuery(relativeWithQuery);
        String color = colorHex(relativeWithQuery);

        String data = load(path, color);
        if (data != null) return data;
        if (fallbackIconPath != null) {
            data = load(fallbackIconPath, color);
            if (data != null) return data;
        }
        return fallbackLocator();
    }

    /**
     * For an absolute internal image locator: re-tints SVG icons that carry a color parameter and
     * returns them as a data URL. Other images are returned unchanged. A failed fetch yields the
     * fallback icon's locator.
     */
    public String retint(String locator) {
        String color = colorHex(locator);
        try {
            FetchedResource res = fetcher.fetch(locator);
            if (res.isSvg() && color != null) {
                return tinted(res, color).toDataUrl();
            }
            return locator;
        } catch (IOException | RuntimeException e) {
            Debug.get().w(TAG, "Image " + locator + " unavailable, using fallback icon", e);
            return fallbackLocator();
        }
    }

    public int cachedCount() {
        return cache.size();
    }

    public void clearCache() {
        cache.clear();
    }

    private String load(String path, String color) {
        String key = path + ":" + (color == null ? "" : color);
        String hit = cache.get(key);
        if (hit != null) return hit;

        try {
            FetchedResource res = fetcher.fetch(resolver.resolve(path));
            if (res.isSvg() && color != null) res = tinted(res, color);
            String data = res.toDataUrl();
            if (cache.size() >= MAX_CACHED_ICONS) {
                Debug.get().d(TAG, "Icon cache full, clearing " + cache.size() + " entries");
                cache.clear();
            }
            cache.put(key, data);
            return data;
        } catch (IOException | RuntimeException e) {
            Debug.get().w(TAG, "Icon " + path + " unavailable", e);
            return null;
        }
    }

    private String fallbackLocator() {
        return (fallbackIconPath == null) ? null : resolver.resolve(fallbackIconPath);
    }

    private static FetchedResource tinted(FetchedResource svg, String color) throws IOException {
        return new FetchedResource(tintSvg(svg.text(), color).getBytes(StandardCharsets.UTF_8), "image/svg+xml");
    }

    /** Sets {@code fill} on the root element of an SVG document. DTDs and external entities are refused. */
    public static String tintSvg(String svg, String colorHex) throws IOException {
        try {
            DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setXIncludeAware(false);
            dbf.setExpandEntityReferences(false);
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = dbf.newDocumentBuilder();
            builder.setErrorHandler(null);

            Document doc = builder.parse(new InputSource(new StringReader(svg)));
            doc.getDocumentElement().setAttribute("fill", colorHex);

            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = tf.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (ParserConfigurationException | SAXException | TransformerException e) {
            throw new IOException("Invalid SVG: " + e.getMessage(), e);
        }
    }

    static String stripQuery(String pathWithQuery) {
        int q = pathWithQuery.indexOf('?');
        return (q < 0) ? pathWithQuery : pathWithQuery.substring(0, q);
    }

    /** The {@code color} query parameter as "#RRGGBB", or null when absent or not a color. */
    static String colorHex(String pathWithQuery) {
        int q = pathWithQuery.indexOf('?');
        if (q < 0) return null;
        String query = pathWithQuery.substring(q + 1);
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = (eq < 0) ? pair : pair.substring(0, eq);
            if (!key.equals("color")) continue;
            String value = (eq < 0) ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            String hex = Colors.normalize(value);
            if (hex == null) {
                if (!value.isEmpty()) Debug.get().d(TAG, "Ignoring icon color " + value);
                return null;
            }
            return "#" + hex;
        }
        return null;
    }
}
