package com.baykanat.ephemeral.api.dto;

import com.baykanat.ephemeral.domain.model.GatewayEventType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Gateway köprüsünden gelen olay payload DTO; Kafka'ya göndermeden önce doğrulanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Gateway event forwarded by the chat platform bridge")
public class GatewayEventRequest {

    private static final String SNOWFLAKE = "^\\d{1,19}$";

    @NotNull(message = "type is required")
    @JsonProperty("type")
    @Schema(description = "Event type", example = "MESSAGE_CREATED")
    private GatewayEventType type;

    @Pattern(regexp = SNOWFLAKE, message = "channel_id must be a numeric snowflake")
    @JsonProperty("channel_id")
    @Schema(description = "Channel snowflake; required for MESSAGE_CREATED and PINS_UPDATED", example = "1234567890123456789")
    private String channelId;

    @Pattern(regexp = SNOWFLAKE, message = "message_id must be a numeric snowflake")
    @JsonProperty("message_id")
    @Schema(description = "Message snowflake; required for MESSAGE_CREATED", example = "1234567890123456790")
    private String messageId;

    @Positive(message = "created_at must be a positive Unix epoch millis value")
    @JsonProperty("created_at")
    @Schema(description = "Message creation time as Unix epoch millis", example = "1771156800000")
    private Long createdAt;

    @JsonProperty("pinned")
    @Schema(description = "Whether the message is pinned", example = "false")
    private Boolean pinned;

    @Positive(message = "last_pin_timestamp must be a positive Unix epoch millis value")
    @JsonProperty("last_pin_timestamp")
    @Schema(description = "Last pin time as Unix epoch millis; absent when the channel has no pins", example = "1771156810000")
    private Long lastPinTimestamp;

    /** Türüne göre zorunlu id alanları dolu mu. */
    @JsonIgnore
    @AssertTrue(message = "channel_id is required for MESSAGE_CREATED and PINS_UPDATED, message_id for MESSAGE_CREATED")
    public boolean isTargetPresent() {
        if (type == null) {
            return true;
        }
        if (type.requiresChannel() && channelId == null) {
            return false;
        }
        return type != GatewayEventType.MESSAGE_CREATED || messageId != null;
    }

    /** 19 haneli id'ler de long sınırını aşabilir; rakam dışı değerleri @Pattern raporlar. */
    @JsonIgnore
    @AssertTrue(message = "channel_id and message_id must fit in a signed 64-bit snowflake")
    public boolean isIdsInRange() {
        return fitsInLong(channelId) && fitsInLong(messageId);
    }

    private static boolean fitsInLong(String snowflake) {
        if (snowflake == null || !snowflake.matches(SNOWFLAKE)) {
            return true;
        }
        try {
            Long.parseLong(snowflake);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
