package com.baykanat.ephemeral.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/** Mesaj deposundan okunan salt okunur mesaj görüntüsü. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageSnapshot {

    private long messageId;
    private long channelId;
    private Instant createdAt;
    private boolean pinned;

    /** createdAt + ttl anına kalan süre; sıfır veya negatifse mesajın süresi dolmuştur. */
    public Duration remainingAt(Instant now, Duration ttl) {
        return Duration.between(now, createdAt.plus(ttl));
    }
}
