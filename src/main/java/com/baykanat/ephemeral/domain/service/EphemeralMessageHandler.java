package com.baykanat.ephemeral.domain.service;

import com.baykanat.ephemeral.domain.model.MessageSnapshot;
import com.baykanat.ephemeral.domain.store.MessageFetchException;
import com.baykanat.ephemeral.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Gateway olaylarının giriş noktaları: yeni mesajı planlar, sabitlenen mesajın silinmesini iptal eder,
 * bağlantı kurulunca veya her pin olayından sonra uzlaştırmayı başlatır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EphemeralMessageHandler {

    private final ChannelTtlDirectory ttlDirectory;
    private final DeletionRegistry registry;
    private final MessageStore messageStore;
    private final ReconciliationService reconciliationService;
    private final Clock clock;

    /** Ephemeral kanaldaki yeni mesaj için now + ttl anında silme planlar. */
    public void onMessageCreated(long messageId, long channelId, Instant createdAt, boolean pinned) {
        Optional<Duration> ttl = ttlDirectory.getTtl(channelId);
        if (ttl.isEmpty()) {
            return;
        }
        if (pinned) {
            log.debug("Message {} in channel {} is pinned on arrival, not scheduling", messageId, channelId);
            return;
        }

        Instant fireAt = clock.instant().plus(ttl.get());
        registry.schedule(channelId, messageId, fireAt);
        registry.pruneFinished();
    }

    /**
     * Son pin zamanı varsa sabitlenmiş mesajların silmesini iptal eder. Pin listesi okunamasa bile
     * tüm kanallar için uzlaştırma her zaman çalışır.
     */
    public CompletableFuture<Void> onPinsUpdated(long channelId, Instant lastPinTimestamp) {
        if (ttlDirectory.getTtl(channelId).isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        if (lastPinTimestamp != null) {
            cancelPinned(channelId);
        } else {
            log.debug("Pins update for channel {} carries no last pin timestamp, nothing to cancel", channelId);
        }
        return reconciliationService.reconcileAll();
    }

    public CompletableFuture<Void> onConnectionReady() {
        log.info("Gateway connection ready, reconciling ephemeral channels");
        return reconciliationService.reconcileAll();
    }

    public CompletableFuture<Void> onConnectionResumed() {
        log.info("Gateway connection resumed, reconciling ephemeral channels");
        return reconciliationService.reconcileAll();
    }

    private void cancelPinned(long channelId) {
        List<MessageSnapshot> pinned;
        try {
            pinned = messageStore.listPinned(channelId);
        } catch (MessageFetchException e) {
            log.warn("Failed to fetch pinned messages for channel {}: {}", channelId, e.getMessage());
            return;
        }

        int cancelled = 0;
        for (MessageSnapshot message : pinned) {
            if (registry.cancel(message.getMessageId())) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending deletion(s) for pinned messages in channel {}", cancelled, channelId);
        }
    }
}
