package com.baykanat.ephemeral.domain.mapper;

import com.baykanat.ephemeral.domain.model.MessageSnapshot;
import com.baykanat.ephemeral.infrastructure.discord.DiscordMessagePayload;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;

/** Discord message JSON → MessageSnapshot. Snowflake string → long, ISO zaman → Instant. */
@Mapper(componentModel = "spring")
public interface DiscordMessageMapper {

    @Mapping(target = "messageId", source = "id")
    @Mapping(target = "channelId", source = "channelId")
    @Mapping(target = "createdAt", source = "timestamp", qualifiedByName = "isoToInstant")
    @Mapping(target = "pinned", source = "pinned")
    MessageSnapshot toSnapshot(DiscordMessagePayload payload);

    List<MessageSnapshot> toSnapshots(List<DiscordMessagePayload> payloads);

    @Named("isoToInstant")
    default Instant isoToInstant(String timestamp) {
        if (timestamp == null) return null;
        return OffsetDateTime.parse(timestamp).toInstant();
    }
}
