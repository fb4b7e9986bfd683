package win.ixuni.bkt.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Backend configuration
 * <p>
 * Generic construction parameters for one backend instance. Backend specific settings
 * (root path, endpoint, credentials, ...) live in {@link #properties}.
 */
@Data
public class BackendConfig {

    /**
     * Backend instance name (unique identifier)
     */
    private String name;

    /**
     * Backend type, "local" or "s3"
     */
    private String type;

    private Map<String, Object> properties = new HashMap<>();

    public BackendConfig() {
    }

    public BackendConfig(String name, String type) {
        this.name = name;
        this.type = type;
    }

    /**
     * Fluent setter used when assembling configs in code
     */
    public BackendConfig with(String key, Object value) {
        if (value != null) {
            properties.put(key, value);
        }
        return this;
    }

    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public Integer getInt(String key, Integer defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.parseInt(value.toString());
    }

    public Long getLong(String key, Long defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString());
    }

    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Stable fingerprint of type and properties, used to share client instances between
     * buckets that resolve to identical settings. Contains credentials: keep it in memory.
     */
    public String fingerprint() {
        return type + ":" + new TreeMap<>(properties);
    }
}
