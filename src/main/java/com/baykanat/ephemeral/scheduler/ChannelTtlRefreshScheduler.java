package com.baykanat.ephemeral.scheduler;

import com.baykanat.ephemeral.infrastructure.persistence.JdbcChannelTtlDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Kanal TTL snapshot'ını ephemeral_channels tablosundan periyodik yeniler (varsayılan 30 sn). */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChannelTtlRefreshScheduler {

    private final JdbcChannelTtlDirectory channelTtlDirectory;

    /** Tablo dışarıdan değiştiğinde yeni TTL'ler sonraki karardan itibaren geçerli olur; hata olursa sadece log. */
    @Scheduled(
            fixedRateString = "${app.scheduler.channel-ttl-refresh-rate:30000}",
            initialDelayString = "${app.scheduler.channel-ttl-refresh-rate:30000}"
    )
    public void refreshChannelTtls() {
        try {
            channelTtlDirectory.refresh();
        } catch (Exception e) {
            log.error("Failed to refresh ephemeral channel directory: {}", e.getMessage(), e);
        }
    }
}
