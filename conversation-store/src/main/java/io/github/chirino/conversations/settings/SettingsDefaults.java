package io.github.chirino.conversations.settings;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import org.eclipse.microprofile.config.Config;

/**
 * Process-wide setting values, read from every {@code conversation-store.settings.defaults.<key>}
 * property. Values that look like booleans or numbers are exposed as such.
 */
@ApplicationScoped
public class SettingsDefaults {

    static final String PREFIX = "conversation-store.settings.defaults.";

    @Inject Config config;

    private Map<String, Object> values;

    SettingsDefaults() {}

    public SettingsDefaults(Map<String, Object> values) {
        this.values = new LinkedHashMap<>(values);
    }

    @PostConstruct
    void init() {
        if (values == null) {
            values = load(config);
        }
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    static Map<String, Object> load(Config config) {
        Map<String, Object> loaded = new LinkedHashMap<>();
        TreeSet<String> names = new TreeSet<>();
        config.getPropertyNames().forEach(names::add);
        for (String name : names) {
            if (!name.startsWith(PREFIX) || name.length() == PREFIX.length()) {
                continue;
            }
            config.getOptionalValue(name, String.class)
                    .ifPresent(raw -> loaded.put(name.substring(PREFIX.length()), coerce(raw)));
        }
        return loaded;
    }

    static Object coerce(String raw) {
        String value = raw.trim();
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        if (value.matches("-?\\d{1,18}")) {
            return Long.parseLong(value);
        }
        if (value.matches("-?\\d+\\.\\d+")) {
            return Double.parseDouble(value);
        }
        return value;
    }
}
