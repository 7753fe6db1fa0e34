package com.baykanat.ephemeral.domain.mapper;

import com.baykanat.ephemeral.api.dto.TrackedDeletionsResponse;
import com.baykanat.ephemeral.domain.model.TrackedDeletion;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;
import java.util.List;

/** Registry kayıtları → GET /deletions yanıt öğeleri. */
@Mapper(componentModel = "spring")
public interface TrackedDeletionMapper {

    @Mapping(target = "messageId", source = "messageId")
    @Mapping(target = "channelId", source = "channelId")
    @Mapping(target = "fireAt", source = "fireAt", qualifiedByName = "instantToIso")
    TrackedDeletionsResponse.Item toItem(TrackedDeletion deletion);

    List<TrackedDeletionsResponse.Item> toItems(List<TrackedDeletion> deletions);

    @Named("instantToIso")
    default String instantToIso(Instant instant) {
        if (instant == null) return null;
        return instant.toString();
    }
}
