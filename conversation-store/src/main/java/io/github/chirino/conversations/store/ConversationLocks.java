package io.github.chirino.conversations.store;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per conversation id. Every read-modify-write of a conversation's metadata or branch
 * documents runs inside {@link #withLock}; different conversations never contend. An entry lives
 * only while some thread holds or waits for it, so ids that are unknown or deleted leave nothing
 * behind.
 */
@ApplicationScoped
public class ConversationLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String conversationId, Supplier<T> action) {
        Entry entry = acquire(conversationId);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(conversationId);
        }
    }

    public void runWithLock(String conversationId, Runnable action) {
        withLock(
                conversationId,
                () -> {
                    action.run();
                    return null;
                });
    }

    /** Number of ids that currently have a lock entry. */
    int size() {
        return locks.size();
    }

    private Entry acquire(String conversationId) {
        return locks.compute(
                conversationId,
                (id, existing) -> {
                    Entry entry = existing != null ? existing : new Entry();
                    entry.users++;
                    return entry;
                });
    }

    private void release(String conversationId) {
        locks.computeIfPresent(
                conversationId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only touched inside compute, which runs atomically per key
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
