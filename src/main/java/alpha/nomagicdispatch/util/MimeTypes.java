package alpha.nomagicdispatch.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file extensions to media types.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class MimeTypes
{
    private MimeTypes() {
        // Empty
    }
    
    /** Used for files with an unknown extension. */
    public static final String FALLBACK = "application/octet-stream";
    
    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("html", "text/html; charset=utf-8"),
            Map.entry("htm",  "text/html; charset=utf-8"),
            Map.entry("css",  "text/css; charset=utf-8"),
            Map.entry("js",   "text/javascript; charset=utf-8"),
            Map.entry("mjs",  "text/javascript; charset=utf-8"),
            Map.entry("json", "application/json"),
            Map.entry("txt",  "text/plain; charset=utf-8"),
            Map.entry("svg",  "image/svg+xml"),
            Map.entry("png",  "image/png"),
            Map.entry("jpg",  "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif",  "image/gif"),
            Map.entry("ico",  "image/x-icon"),
            Map.entry("webp", "image/webp"),
            Map.entry("wasm", "application/wasm"),
            Map.entry("pdf",  "application/pdf"));
    
    /**
     * Returns the media type of the given file.
     * 
     * @param file to lookup
     * @return the media type (never {@code null})
     */
    public static String of(Path file) {
        var name = file.getFileName();
        if (name == null) {
            return FALLBACK;
        }
        var str = name.toString();
        int dot = str.lastIndexOf('.');
        if (dot == -1) {
            return FALLBACK;
        }
        var ext = str.substring(dot + 1).toLowerCase(Locale.ROOT);
        return BY_EXTENSION.getOrDefault(ext, FALLBACK);
    }
}
