package io.github.chirino.conversations.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.chirino.conversations.persistence.ConversationFiles;
import io.github.chirino.conversations.persistence.JsonDocuments;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Per-conversation settings. The conversation's {@code settings.json} holds only its overrides;
 * resolved settings are the defaults with every non-null override applied on top.
 */
@ApplicationScoped
public class SettingsService {

    private static final Logger LOG = Logger.getLogger(SettingsService.class);
    private static final TypeReference<Map<String, Object>> SETTINGS_TYPE =
            new TypeReference<>() {};

    ConversationFiles files;
    JsonDocuments documents;
    SettingsDefaults defaults;

    SettingsService() {}

    @Inject
    public SettingsService(
            ConversationFiles files, JsonDocuments documents, SettingsDefaults defaults) {
        this.files = files;
        this.documents = documents;
        this.defaults = defaults;
    }

    public Map<String, Object> resolve(String conversationId) {
        Map<String, Object> resolved = new LinkedHashMap<>(defaults.values());
        overrides(conversationId)
                .forEach(
                        (key, value) -> {
                            if (value != null) {
                                resolved.put(key, value);
                            }
                        });
        return resolved;
    }

    public Map<String, Object> overrides(String conversationId) {
        Map<String, Object> stored =
                documents
                        .read(files.settingsFile(conversationId), Map.class)
                        .map(raw -> documents.mapper().convertValue(raw, SETTINGS_TYPE))
                        .orElseGet(Map::of);
        return new LinkedHashMap<>(stored);
    }

    /**
     * Merges {@code changes} into the stored overrides. A null value removes the override so the
     * default applies again. Callers hold the conversation lock.
     */
    public Map<String, Object> update(String conversationId, Map<String, Object> changes) {
        Map<String, Object> overrides = overrides(conversationId);
        changes.forEach(
                (key, value) -> {
                    if (value == null) {
                        overrides.remove(key);
                    } else {
                        overrides.put(key, value);
                    }
                });
        documents.write(files.settingsFile(conversationId), overrides);
        LOG.debugf("Updated settings: conversationId=%s keys=%s", conversationId, changes.keySet());
        return resolve(conversationId);
    }
}
