package space.ketterling.sensornet.api;

/**
 * Caches nothing; every request is computed.
 */
public class NoopResponseCache implements ResponseCache {
    @Override
    public CachedResponse get(String key) {
        return null;
    }

    @Override
    public CachedResponse put(String key, String body) {
        return CachedResponse.of(body, 0);
    }
}
