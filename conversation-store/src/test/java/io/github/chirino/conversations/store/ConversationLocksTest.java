package io.github.chirino.conversations.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.chirino.conversations.TestStores;
import io.github.chirino.conversations.api.dto.AddMessageRequest;
import io.github.chirino.conversations.api.dto.CreateConversationRequest;
import io.github.chirino.conversations.model.MessageContent;
import io.github.chirino.conversations.model.MessageRole;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversationLocksTest {

    @TempDir Path dataDir;

    @Test
    void entry_exists_only_while_held() {
        ConversationLocks locks = new ConversationLocks();

        int inside = locks.withLock("c1", locks::size);

        assertEquals(1, inside);
        assertEquals(0, locks.size());
    }

    @Test
    void reentrant_use_keeps_the_entry_until_the_outermost_release() {
        ConversationLocks locks = new ConversationLocks();

        int nested = locks.withLock("c1", () -> locks.withLock("c1", locks::size));

        assertEquals(1, nested);
        assertEquals(0, locks.size());
    }

    @Test
    void release_happens_when_the_action_fails() {
        ConversationLocks locks = new ConversationLocks();

        assertThrows(
                IllegalStateException.class,
                () ->
                        locks.runWithLock(
                                "c1",
                                () -> {
                                    throw new IllegalStateException("boom");
                                }));

        assertEquals(0, locks.size());
    }

    @Test
    void unknown_and_deleted_conversations_leave_no_entries() {
        TestStores stores = TestStores.create(dataDir);
        AddMessageRequest request = new AddMessageRequest();
        request.setRole(MessageRole.USER);
        request.setContent(MessageContent.text("hi"));

        for (int i = 0; i < 100; i++) {
            String unknown = UUID.randomUUID().toString();
            assertThrows(
                    ResourceNotFoundException.class,
                    () -> stores.store.appendMessage(unknown, request));
        }
        String id = stores.store.createConversation(new CreateConversationRequest()).getId();
        stores.store.appendMessage(id, request);
        stores.store.deleteConversation(id);

        assertEquals(0, stores.locks.size());
    }

    @Test
    void waiting_threads_share_the_entry_and_run_one_at_a_time() throws Exception {
        ConversationLocks locks = new ConversationLocks();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        try {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] =
                        executor.submit(
                                () -> {
                                    start.await();
                                    for (int n = 0; n < 200; n++) {
                                        locks.runWithLock(
                                                "c1",
                                                () -> {
                                                    int now = active.incrementAndGet();
                                                    maxActive.accumulateAndGet(now, Math::max);
                                                    active.decrementAndGet();
                                                });
                                    }
                                    return null;
                                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxActive.get());
        assertEquals(0, locks.size());
    }
}
