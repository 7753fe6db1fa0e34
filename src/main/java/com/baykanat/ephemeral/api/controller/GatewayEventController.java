package com.baykanat.ephemeral.api.controller;

import com.baykanat.ephemeral.api.dto.BulkGatewayEventRequest;
import com.baykanat.ephemeral.api.dto.GatewayEventRequest;
import com.baykanat.ephemeral.api.dto.GatewayEventResponse;
import com.baykanat.ephemeral.infrastructure.kafka.GatewayEventKafkaProducer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /gateway/events ve POST /gateway/events/bulk. Olay Kafka'ya gönderilir, 202 döner; işleme consumer'da. */
@Slf4j
@RestController
@RequestMapping("/gateway/events")
@RequiredArgsConstructor
@Tag(name = "Gateway Events", description = "Endpoints for forwarding chat gateway events to the scheduler")
public class GatewayEventController {

    private final GatewayEventKafkaProducer kafkaProducer;

    /** Tek olay alır, doğrular, Kafka'ya gönderir. Geçersiz payload → 400, geçerli → 202. */
    @PostMapping
    @Operation(summary = "Forward a single gateway event", description = "Accepts and queues a gateway event for async handling")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Event accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable (Kafka down)")
    })
    public ResponseEntity<GatewayEventResponse> forwardEvent(@Valid @RequestBody GatewayEventRequest event) throws Exception {
        log.debug("Received gateway event: type={}, channel_id={}, message_id={}",
                event.getType(), event.getChannelId(), event.getMessageId());

        kafkaProducer.send(event);

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(GatewayEventResponse.builder()
                        .status("accepted")
                        .acceptedCount(1)
                        .message("Event queued for processing")
                        .build());
    }

    /** En fazla 1000 olay kabul eder; hepsi doğrulanıp Kafka'ya paralel gönderilir. */
    @PostMapping("/bulk")
    @Operation(summary = "Forward gateway events in bulk", description = "Accepts up to 1000 gateway events for async handling")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Events accepted for processing"),
            @ApiResponse(responseCode = "400", description = "Invalid event payload(s)"),
            @ApiResponse(responseCode = "503", description = "Service temporarily unavailable")
    })
    public ResponseEntity<GatewayEventResponse> forwardBulkEvents(@Valid @RequestBody BulkGatewayEventRequest bulkRequest) throws Exception {
        log.debug("Received bulk request with {} gateway events", bulkRequest.getEvents().size());

        kafkaProducer.sendBatch(bulkRequest.getEvents());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(GatewayEventResponse.builder()
                        .status("accepted")
                        .acceptedCount(bulkRequest.getEvents().size())
                        .message("Events queued for processing")
                        .build());
    }
}
