package com.baykanat.ephemeral.domain.service;

import com.baykanat.ephemeral.domain.model.TrackedDeletion;
import com.baykanat.ephemeral.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bekleyen silmelerin kaydı: mesaj id → iptal edilebilir zamanlayıcı. Okumalar paralel,
 * ekleme/çıkarma write lock altında. Bir mesaj için aynı anda en fazla bir canlı kayıt tutulur.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeletionRegistry {

    private final TaskScheduler taskScheduler;
    private final MessageStore messageStore;

    private final Map<Long, TrackedDeletion> deletions = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** fireAt anında mesajı silecek zamanlayıcı kurar. Mesaj zaten izleniyorsa mevcut kayıt döner. */
    public TrackedDeletion schedule(long channelId, long messageId, Instant fireAt) {
        lock.writeLock().lock();
        try {
            TrackedDeletion existing = deletions.get(messageId);
            if (existing != null && !existing.isFinished()) {
                log.debug("Message {} already scheduled for deletion at {}, keeping existing timer",
                        messageId, existing.getFireAt());
                return existing;
            }

            // Zamanlayıcı tam kurulduktan sonra map'e girer
            TrackedDeletion deletion = new TrackedDeletion(messageId, channelId, fireAt);
            deletion.attach(taskScheduler.schedule(() -> fire(deletion), fireAt));
            deletions.put(messageId, deletion);
            log.debug("Scheduled deletion of message {} in channel {} at {}", messageId, channelId, fireAt);
            return deletion;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Kaydı çıkarır ve zamanlayıcıyı durdurur. Kayıt bulunduysa true. */
    public boolean cancel(long messageId) {
        TrackedDeletion removed;
        lock.writeLock().lock();
        try {
            removed = deletions.remove(messageId);
        } finally {
            lock.writeLock().unlock();
        }

        if (removed == null) {
            return false;
        }
        if (!removed.cancel()) {
            log.debug("Deletion of message {} already started, cancel is a no-op", messageId);
        }
        return true;
    }

    public boolean contains(long messageId) {
        lock.readLock().lock();
        try {
            return deletions.containsKey(messageId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** İzlenen mesaj id'lerinin kopyası. */
    public Set<Long> trackedIds() {
        lock.readLock().lock();
        try {
            return new HashSet<>(deletions.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** İzlenen silmeler, fire_at sırasıyla. */
    public List<TrackedDeletion> snapshot() {
        List<TrackedDeletion> copy;
        lock.readLock().lock();
        try {
            copy = new ArrayList<>(deletions.values());
        } finally {
            lock.readLock().unlock();
        }
        copy.sort(Comparator.comparing(TrackedDeletion::getFireAt));
        return copy;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return deletions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Zamanlayıcısı tamamlanmış kayıtları siler; silinen sayıyı döner. */
    public int pruneFinished() {
        lock.writeLock().lock();
        try {
            int before = deletions.size();
            deletions.values().removeIf(TrackedDeletion::isFinished);
            return before - deletions.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Zamanlayıcı gövdesi: mesajı siler, hata olursa sadece log; kaydı her durumda kendisi çıkarır. */
    private void fire(TrackedDeletion deletion) {
        try {
            messageStore.deleteMessage(deletion.getChannelId(), deletion.getMessageId());
            log.debug("Deleted expired message {} in channel {}", deletion.getMessageId(), deletion.getChannelId());
        } catch (Exception e) {
            log.error("Failed to delete message {} in channel {}: {}",
                    deletion.getMessageId(), deletion.getChannelId(), e.getMessage());
        } finally {
            lock.writeLock().lock();
            try {
                // Yerine yeni kayıt geldiyse ona dokunma
                deletions.remove(deletion.getMessageId(), deletion);
            } finally {
                lock.writeLock().unlock();
            }
        }
    }
}
