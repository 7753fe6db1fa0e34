package com.baykanat.ephemeral.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Handler'a iletilen domain olayı; DTO'dan GatewayEventMapper ile üretilir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayEvent {

    private GatewayEventType type;
    private Long channelId;
    private Long messageId;
    private Instant createdAt;
    private boolean pinned;
    private Instant lastPinTimestamp; // null → son pin zamanı yok
}
