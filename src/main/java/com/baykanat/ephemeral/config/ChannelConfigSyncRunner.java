package com.baykanat.ephemeral.config;

import com.baykanat.ephemeral.infrastructure.persistence.ChannelTtlJdbcRepository;
import com.baykanat.ephemeral.infrastructure.persistence.JdbcChannelTtlDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Uygulama açılışında ephemeral_channels tablosunu application.yaml kanallarıyla senkronize eder.
 * Varsayılan olarak yalnızca upsert yapılır; app.ephemeral.prune-unconfigured ile yaml'da olmayan kanallar silinir.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class ChannelConfigSyncRunner implements ApplicationRunner {

    private final ChannelTtlJdbcRepository channelTtlRepository;
    private final JdbcChannelTtlDirectory channelTtlDirectory;
    private final AppProperties appProperties;

    @Override
    public void run(ApplicationArguments args) {
        Map<Long, Duration> configured = appProperties.getEphemeral().getChannels();
        configured.forEach((channelId, ttl) -> {
            if (ttl.isNegative() || ttl.isZero()) {
                throw new IllegalStateException("TTL for ephemeral channel " + channelId + " must be positive: " + ttl);
            }
        });

        channelTtlRepository.upsertAll(configured);
        log.debug("ephemeral_channels: synced {} configured channel(s)", configured.size());

        if (appProperties.getEphemeral().isPruneUnconfigured()) {
            int removed = channelTtlRepository.deleteAllExcept(configured.keySet());
            if (removed > 0) {
                log.info("ephemeral_channels: removed {} channel(s) no longer in configuration", removed);
            }
        }

        channelTtlDirectory.refresh();
    }
}
