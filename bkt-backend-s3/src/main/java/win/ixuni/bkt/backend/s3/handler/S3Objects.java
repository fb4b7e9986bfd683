package win.ixuni.bkt.backend.s3.handler;

import java.net.URLConnection;

/**
 * S3 响应转换工具
 */
public final class S3Objects {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private S3Objects() {
    }

    /**
     * Strip the surrounding quotes S3 puts on ETags
     */
    public static String unquote(String etag) {
        if (etag == null) {
            return "";
        }
        String trimmed = etag.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * Listings carry no content type; guess it from the extension instead of one HEAD per key
     */
    public static String guessContentType(String key) {
        String guessed = URLConnection.guessContentTypeFromName(key);
        return guessed != null ? guessed : DEFAULT_CONTENT_TYPE;
    }

    public static String orDefault(String contentType) {
        return contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType;
    }
}
