package com.baykanat.ephemeral.domain.service;

import com.baykanat.ephemeral.config.AppProperties;
import com.baykanat.ephemeral.domain.store.MessageDeleteException;
import com.baykanat.ephemeral.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/** Süresi dolmuş mesajları 100'lük parçalar halinde siler. Parça hataları loglanır, sonraki parçalar devam eder. */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchDeletionExecutor {

    /** Depo tarafındaki toplu silme üst sınırı. */
    static final int STORE_BATCH_LIMIT = 100;

    private final MessageStore messageStore;
    private final AppProperties appProperties;

    /** Tek elemanlı parça tekli silme, diğerleri toplu silme ile gider. Başarıyla silinen mesaj sayısını döner. */
    public int deleteExpired(long channelId, List<Long> messageIds) {
        if (messageIds.isEmpty()) {
            return 0;
        }

        int chunkSize = Math.max(1, Math.min(appProperties.getEphemeral().getMaxBatchSize(), STORE_BATCH_LIMIT));
        int deleted = 0;
        int failedChunks = 0;

        for (int from = 0; from < messageIds.size(); from += chunkSize) {
            List<Long> chunk = List.copyOf(messageIds.subList(from, Math.min(from + chunkSize, messageIds.size())));
            try {
                if (chunk.size() == 1) {
                    messageStore.deleteMessage(channelId, chunk.get(0));
                } else {
                    messageStore.deleteMessages(channelId, chunk);
                }
                deleted += chunk.size();
            } catch (MessageDeleteException e) {
                failedChunks++;
                int failed = failedWithin(chunk, e.getMessageIds());
                deleted += chunk.size() - failed;
                log.warn("Failed to delete {} of {} message(s) in ephemeral channel {}: {}",
                        failed, chunk.size(), channelId, e.getMessage());
            } catch (Exception e) {
                failedChunks++;
                log.warn("Failed to delete {} message(s) in ephemeral channel {}: {}",
                        chunk.size(), channelId, e.getMessage());
            }
        }

        log.info("Expired batch for channel {}: {} of {} messages deleted, {} failed chunk(s)",
                channelId, deleted, messageIds.size(), failedChunks);
        return deleted;
    }

    /** Hata hangi id'leri bildirmiyorsa parçanın tamamı başarısız sayılır. */
    private static int failedWithin(List<Long> chunk, List<Long> failedIds) {
        if (failedIds.isEmpty()) {
            return chunk.size();
        }
        return (int) chunk.stream().filter(failedIds::contains).count();
    }
}
