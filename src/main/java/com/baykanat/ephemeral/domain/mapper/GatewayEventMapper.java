package com.baykanat.ephemeral.domain.mapper;

import com.baykanat.ephemeral.api.dto.GatewayEventRequest;
import com.baykanat.ephemeral.domain.model.GatewayEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.time.Instant;

/** GatewayEventRequest → GatewayEvent ve Kafka record value → GatewayEventRequest dönüşümleri. */
@Mapper(componentModel = "spring")
public interface GatewayEventMapper {

    /** Map gelen record value'ları için paylaşılan ObjectMapper. */
    ObjectMapper JSON_MAPPER = new ObjectMapper();

    /** GatewayEventRequest → GatewayEvent; snowflake string → Long, epoch millis → Instant. */
    @Mapping(target = "createdAt", source = "createdAt", qualifiedByName = "epochMilliToInstant")
    @Mapping(target = "lastPinTimestamp", source = "lastPinTimestamp", qualifiedByName = "epochMilliToInstant")
    @Mapping(target = "pinned", source = "pinned", defaultValue = "false")
    GatewayEvent toGatewayEvent(GatewayEventRequest request);

    /** Kafka value GatewayEventRequest ise döner, değilse Map vb. üzerinden GatewayEventRequest'e çevirir. */
    default GatewayEventRequest fromRecordValue(Object value) {
        if (value instanceof GatewayEventRequest request) {
            return request;
        }
        return JSON_MAPPER.convertValue(value, GatewayEventRequest.class);
    }

    @Named("epochMilliToInstant")
    default Instant epochMilliToInstant(Long epochMillis) {
        if (epochMillis == null) return null;
        return Instant.ofEpochMilli(epochMillis);
    }
}
