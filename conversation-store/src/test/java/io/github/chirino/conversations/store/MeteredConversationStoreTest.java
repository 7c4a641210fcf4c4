package io.github.chirino.conversations.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.conversations.branch.BranchCoordinate;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MeteredConversationStoreTest {

    private SimpleMeterRegistry registry;
    private ConversationStore delegate;
    private MeteredConversationStore store;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        delegate = mock(ConversationStore.class);
        store = new MeteredConversationStore(registry, delegate);
    }

    @Test
    void records_one_timer_sample_per_call() {
        when(delegate.truncateFrom("c1", null, 0)).thenReturn(true);

        assertTrue(store.truncateFrom("c1", null, 0));
        store.truncateFrom("c1", null, 0);

        assertEquals(2, timer("truncateFrom").count());
    }

    @Test
    void passes_results_through_unchanged() {
        when(delegate.switchBranch("c1", null, 0, 1))
                .thenReturn(Optional.of(BranchCoordinate.of(1)));

        assertEquals(Optional.of(BranchCoordinate.of(1)), store.switchBranch("c1", null, 0, 1));
        verify(delegate).switchBranch("c1", null, 0, 1);
        assertEquals(1, timer("switchBranch").count());
    }

    @Test
    void void_operations_are_timed() {
        store.setSessionId("c1", "s1");

        verify(delegate).setSessionId("c1", "s1");
        assertEquals(1, timer("setSessionId").count());
    }

    @Test
    void failures_propagate_and_are_still_timed() {
        when(delegate.getConversation("missing", null))
                .thenThrow(new ResourceNotFoundException("conversation", "missing"));

        assertThrows(ResourceNotFoundException.class, () -> store.getConversation("missing", null));
        assertEquals(1, timer("getConversation").count());
    }

    @Test
    void directory_lookups_are_timed() {
        when(delegate.getWorkspacePath("c1")).thenReturn(Path.of("data", "c1", "workspace"));
        when(delegate.getMemoriesPath("missing"))
                .thenThrow(new ResourceNotFoundException("conversation", "missing"));

        assertEquals(Path.of("data", "c1", "workspace"), store.getWorkspacePath("c1"));
        assertThrows(ResourceNotFoundException.class, () -> store.getMemoriesPath("missing"));

        assertEquals(1, timer("getWorkspacePath").count());
        assertEquals(1, timer("getMemoriesPath").count());
    }

    private Timer timer(String operation) {
        return registry.get(MeteredConversationStore.METRIC_NAME).tag("operation", operation).timer();
    }
}
