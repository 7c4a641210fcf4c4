package io.github.chirino.conversations.config;

import io.github.chirino.conversations.store.ConversationStore;
import io.github.chirino.conversations.store.MeteredConversationStore;
import io.github.chirino.conversations.store.impl.FileConversationStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class ConversationStoreSelector {

    @ConfigProperty(name = "conversation-store.datastore.type", defaultValue = "file")
    String datastoreType;

    @Inject Instance<FileConversationStore> fileConversationStore;

    @Inject MeterRegistry meterRegistry;

    private ConversationStore meteredStore;

    @PostConstruct
    void init() {
        ConversationStore delegate = selectDelegate();
        meteredStore = new MeteredConversationStore(meterRegistry, delegate);
    }

    public ConversationStore getStore() {
        return meteredStore;
    }

    private ConversationStore selectDelegate() {
        String type = datastoreType == null ? "file" : datastoreType.trim().toLowerCase();
        if ("file".equals(type)) {
            return fileConversationStore.get();
        }
        throw new IllegalStateException(
                "Unsupported conversation-store.datastore.type: " + datastoreType);
    }
}
