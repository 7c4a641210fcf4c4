package io.github.chirino.conversations.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.chirino.conversations.persistence.ConversationFiles;
import io.github.chirino.conversations.persistence.JsonDocuments;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/** Location and format of the conversation documents on disk. */
@ApplicationScoped
public class StorageConfig {

    private static final Logger LOG = Logger.getLogger(StorageConfig.class);

    @ConfigProperty(name = "conversation-store.data-dir", defaultValue = "data/conversations")
    String dataDir;

    @ConfigProperty(name = "conversation-store.pretty-print", defaultValue = "true")
    boolean prettyPrint;

    @Produces
    @Singleton
    public ConversationFiles conversationFiles() {
        ConversationFiles files = new ConversationFiles(Path.of(dataDir));
        LOG.infof("Storing conversations under %s", files.root());
        return files;
    }

    @Produces
    @Singleton
    public JsonDocuments jsonDocuments(ObjectMapper mapper) {
        return new JsonDocuments(mapper, prettyPrint);
    }
}
