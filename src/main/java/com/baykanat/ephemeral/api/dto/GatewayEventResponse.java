package com.baykanat.ephemeral.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Gateway olay kabul yanıtı: 202 ile status ve kabul edilen olay sayısı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Response for gateway event submission")
public class GatewayEventResponse {

    @Schema(description = "Status message", example = "accepted")
    private String status;

    @Schema(description = "Number of events accepted", example = "1")
    private int acceptedCount;

    @Schema(description = "Additional message", example = "Event queued for processing")
    private String message;
}
