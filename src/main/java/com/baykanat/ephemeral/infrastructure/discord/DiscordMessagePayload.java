package com.baykanat.ephemeral.infrastructure.discord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Discord message nesnesinin kullanılan alanları; snowflake'ler string gelir. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscordMessagePayload {

    @JsonProperty("id")
    private String id;

    @JsonProperty("channel_id")
    private String channelId;

    /** ISO-8601, offset'li (ör. 2024-05-01T10:15:30.123000+00:00). */
    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("pinned")
    private boolean pinned;
}
