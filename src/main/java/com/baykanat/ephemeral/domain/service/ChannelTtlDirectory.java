package com.baykanat.ephemeral.domain.service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/** Kanal → TTL eşlemesi. Çekirdek yalnızca okur ve sonucu tek karardan uzun tutmaz. */
public interface ChannelTtlDirectory {

    /** Kanal ephemeral değilse boş döner. */
    Optional<Duration> getTtl(long channelId);

    /** Yapılandırılmış tüm kanalların o anki değişmez kopyası. */
    Map<Long, Duration> channels();
}
