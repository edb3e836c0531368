package space.ketterling.sensornet.api;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache of serialized JSON responses keyed by request. The cache decides how
 * long an entry lives.
 */
public interface ResponseCache {

    /**
     * Live entry for {@code key}, or null.
     */
    CachedResponse get(String key);

    /**
     * Stores {@code body} and returns the entry to serve.
     */
    CachedResponse put(String key, String body);

    record CachedResponse(String body, String etag, int maxAgeSeconds) {
        static CachedResponse of(String body, int maxAgeSeconds) {
            return new CachedResponse(body, etag(body), maxAgeSeconds);
        }

        /**
         * Strong ETag: quoted SHA-256 of the UTF-8 body.
         */
        static String etag(String body) {
            try {
                byte[] digest = MessageDigest.getInstance("SHA-256").digest(body.getBytes(StandardCharsets.UTF_8));
                return "\"" + HexFormat.of().formatHex(digest) + "\"";
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 is not available", e);
            }
        }
    }
}
