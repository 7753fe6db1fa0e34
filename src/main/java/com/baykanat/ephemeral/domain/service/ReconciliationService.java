package com.baykanat.ephemeral.domain.service;

import com.baykanat.ephemeral.domain.model.MessageSnapshot;
import com.baykanat.ephemeral.domain.model.ReconciliationReport;
import com.baykanat.ephemeral.domain.store.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Yeniden bağlanmada registry'yi mesaj deposundan türetir: izlenmeyen ve sabitlenmemiş mesajlar için
 * kalan süre pozitifse zamanlayıcı kurar, değilse toplu silmeye gönderir. Kanallar birbirinden bağımsız.
 */
@Slf4j
@Service
public class ReconciliationService {

    private final ChannelTtlDirectory ttlDirectory;
    private final MessageStore messageStore;
    private final DeletionRegistry registry;
    private final BatchDeletionExecutor batchDeletionExecutor;
    private final Executor reconciliationExecutor;
    private final Clock clock;

    public ReconciliationService(ChannelTtlDirectory ttlDirectory,
                                 MessageStore messageStore,
                                 DeletionRegistry registry,
                                 BatchDeletionExecutor batchDeletionExecutor,
                                 @Qualifier("reconciliationExecutor") Executor reconciliationExecutor,
                                 Clock clock) {
        this.ttlDirectory = ttlDirectory;
        this.messageStore = messageStore;
        this.registry = registry;
        this.batchDeletionExecutor = batchDeletionExecutor;
        this.reconciliationExecutor = reconciliationExecutor;
        this.clock = clock;
    }

    /** Yapılandırılmış her kanal için ayrı görev başlatır; bir kanalın hatası diğerlerini etkilemez. */
    public CompletableFuture<Void> reconcileAll() {
        Map<Long, Duration> channels = ttlDirectory.channels();
        log.debug("Starting reconciliation sweep over {} ephemeral channel(s)", channels.size());

        CompletableFuture<?>[] sweeps = channels.entrySet().stream()
                .map(entry -> CompletableFuture.runAsync(
                        () -> reconcileChannelSafely(entry.getKey(), entry.getValue()), reconciliationExecutor))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(sweeps);
    }

    /** Tek kanal turu. Geçmiş okunamazsa MessageFetchException fırlatır; silme hataları turu durdurmaz. */
    public ReconciliationReport reconcileChannel(long channelId, Duration ttl) {
        // Karar vermeden önce geçmişin tamamı okunur
        List<MessageSnapshot> history;
        try (Stream<MessageSnapshot> messages = messageStore.listMessages(channelId)) {
            history = messages.toList();
        }

        Set<Long> tracked = registry.trackedIds();
        Instant now = clock.instant();
        List<Long> expired = new ArrayList<>();
        int scheduled = 0;
        int pinnedCancelled = 0;

        for (MessageSnapshot message : history) {
            long messageId = message.getMessageId();
            if (message.isPinned()) {
                // Kaçırılan pin olayı: izlenen sabit mesaj silinmemeli
                if (tracked.contains(messageId) && registry.cancel(messageId)) {
                    pinnedCancelled++;
                }
                continue;
            }
            if (tracked.contains(messageId)) {
                continue;
            }

            Duration remaining = message.remainingAt(now, ttl);
            if (remaining.isNegative() || remaining.isZero()) {
                expired.add(messageId);
            } else {
                registry.schedule(channelId, messageId, now.plus(remaining));
                scheduled++;
            }
        }
        registry.pruneFinished();

        int deleted = expired.isEmpty() ? 0 : batchDeletionExecutor.deleteExpired(channelId, expired);

        ReconciliationReport report = ReconciliationReport.builder()
                .channelId(channelId)
                .scanned(history.size())
                .scheduled(scheduled)
                .expired(expired.size())
                .deleted(deleted)
                .pinnedCancelled(pinnedCancelled)
                .build();
        log.info("Reconciled channel {}: scanned={}, scheduled={}, expired={}, deleted={}, pinnedCancelled={}",
                channelId, report.getScanned(), report.getScheduled(), report.getExpired(),
                report.getDeleted(), report.getPinnedCancelled());
        return report;
    }

    private void reconcileChannelSafely(long channelId, Duration ttl) {
        try {
            reconcileChannel(channelId, ttl);
        } catch (Exception e) {
            log.error("Failed to reconcile ephemeral channel {}: {}", channelId, e.getMessage(), e);
        }
    }
}
