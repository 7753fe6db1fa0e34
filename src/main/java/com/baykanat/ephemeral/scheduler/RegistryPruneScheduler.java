package com.baykanat.ephemeral.scheduler;

import com.baykanat.ephemeral.domain.service.DeletionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Tamamlanmış ama registry'de kalmış silme kayıtlarını periyodik temizler (varsayılan 5 dk). */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegistryPruneScheduler {

    private final DeletionRegistry deletionRegistry;

    @Scheduled(
            fixedRateString = "${app.scheduler.registry-prune-rate:300000}",
            initialDelayString = "60000"
    )
    public void pruneFinishedDeletions() {
        try {
            int pruned = deletionRegistry.pruneFinished();
            if (pruned > 0) {
                log.info("Registry prune: removed {} finished deletion(s), {} still pending",
                        pruned, deletionRegistry.size());
            } else {
                log.debug("Registry prune: nothing to remove, {} pending", deletionRegistry.size());
            }
        } catch (Exception e) {
            log.error("Failed to prune deletion registry: {}", e.getMessage(), e);
        }
    }
}
