package com.baykanat.ephemeral.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Registry'deki bekleyen silmeler: toplam ve fire_at sıralı liste. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Pending deletions tracked by the scheduler")
public class TrackedDeletionsResponse {

    @JsonProperty("count")
    @Schema(description = "Number of tracked deletions", example = "42")
    private int count;

    @JsonProperty("deletions")
    @Schema(description = "Tracked deletions ordered by fire time")
    private List<Item> deletions;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(description = "Single scheduled deletion")
    public static class Item {
        @JsonProperty("message_id")
        @Schema(description = "Message snowflake", example = "1234567890123456790")
        private String messageId;

        @JsonProperty("channel_id")
        @Schema(description = "Channel snowflake", example = "1234567890123456789")
        private String channelId;

        @JsonProperty("fire_at")
        @Schema(description = "Scheduled deletion time (ISO-8601)", example = "2026-10-19T12:00:00Z")
        private String fireAt;
    }
}
