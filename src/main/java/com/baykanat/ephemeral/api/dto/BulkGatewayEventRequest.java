package com.baykanat.ephemeral.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Toplu gateway olay isteği; en fazla 1000 olay, her biri @Valid ile doğrulanır. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Bulk gateway event payload")
public class BulkGatewayEventRequest {

    @NotEmpty(message = "events list must not be empty")
    @Size(max = 1000, message = "Maximum 1000 events per bulk request")
    @Valid
    @Schema(description = "Gateway events to forward")
    private List<GatewayEventRequest> events;
}
