package com.baykanat.ephemeral.infrastructure.persistence;

import com.baykanat.ephemeral.domain.service.ChannelTtlDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** ephemeral_channels tablosunun değişmez snapshot'ı; ilk erişimde yüklenir, scheduler ile yenilenir. */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcChannelTtlDirectory implements ChannelTtlDirectory {

    private final ChannelTtlJdbcRepository repository;

    private final AtomicReference<Map<Long, Duration>> snapshot = new AtomicReference<>();

    @Override
    public Optional<Duration> getTtl(long channelId) {
        return Optional.ofNullable(current().get(channelId));
    }

    @Override
    public Map<Long, Duration> channels() {
        return current();
    }

    /** Tabloyu yeniden okur. Hata olursa önceki snapshot korunur, hata yukarı iletilir. */
    public Map<Long, Duration> refresh() {
        Map<Long, Duration> loaded = Map.copyOf(repository.findAll());
        Map<Long, Duration> previous = snapshot.getAndSet(loaded);
        if (!loaded.equals(previous)) {
            log.info("Ephemeral channel directory loaded: {} channel(s)", loaded.size());
        }
        return loaded;
    }

    private Map<Long, Duration> current() {
        Map<Long, Duration> channels = snapshot.get();
        return channels != null ? channels : refresh();
    }
}
