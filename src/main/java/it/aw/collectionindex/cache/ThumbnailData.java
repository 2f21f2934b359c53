package it.aw.collectionindex.cache;

import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

/**
 * Thumbnail pronta da servire: byte e content type.
 * In cache e nei summary viaggia come data URL ({@code data:image/webp;base64,...}).
 */
public record ThumbnailData(byte[] bytes, String contentType) {

    private static final String DATA_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64,";

    public ThumbnailData {
        Objects.requireNonNull(bytes, "bytes");
        contentType = contentType == null ? "image/jpeg" : contentType;
    }

    public String toDataUrl() {
        return DATA_PREFIX + contentType + BASE64_MARKER + Base64.getEncoder().encodeToString(bytes);
    }

    public static ThumbnailData fromDataUrl(String dataUrl) {
        int marker = dataUrl.indexOf(BASE64_MARKER);
        if (!dataUrl.startsWith(DATA_PREFIX) || marker < 0) {
            throw new IllegalArgumentException("Data URL di thumbnail non valido");
        }
        String contentType = dataUrl.substring(DATA_PREFIX.length(), marker);
        byte[] bytes = Base64.getDecoder().decode(dataUrl.substring(marker + BASE64_MARKER.length()));
        return new ThumbnailData(bytes, contentType);
    }

    /** Content type dedotto dall'estensione del file; jpeg se sconosciuta. */
    public static String contentTypeFor(String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        String extension = dot >= 0 ? lower.substring(dot + 1) : "";
        return switch (extension) {
            case "png" -> "image/png";
            case "webp" -> "image/webp";
            case "gif" -> "image/gif";
            case "bmp" -> "image/bmp";
            default -> "image/jpeg";
        };
    }
}
