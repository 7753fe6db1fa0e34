package com.baykanat.ephemeral.api.controller;

import com.baykanat.ephemeral.api.dto.TrackedDeletionsResponse;
import com.baykanat.ephemeral.domain.mapper.TrackedDeletionMapper;
import com.baykanat.ephemeral.domain.model.TrackedDeletion;
import com.baykanat.ephemeral.domain.service.DeletionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** GET /deletions: registry'de bekleyen silmeleri fire_at sırasıyla döner (salt okunur). */
@RestController
@RequestMapping("/deletions")
@RequiredArgsConstructor
@Tag(name = "Deletions", description = "Pending ephemeral message deletions")
public class DeletionController {

    private final DeletionRegistry deletionRegistry;
    private final TrackedDeletionMapper trackedDeletionMapper;

    @GetMapping
    @Operation(summary = "List pending deletions", description = "Returns every tracked deletion ordered by fire time")
    @ApiResponse(responseCode = "200", description = "Pending deletions retrieved")
    public ResponseEntity<TrackedDeletionsResponse> listPendingDeletions() {
        List<TrackedDeletion> deletions = deletionRegistry.snapshot();
        return ResponseEntity.ok(TrackedDeletionsResponse.builder()
                .count(deletions.size())
                .deletions(trackedDeletionMapper.toItems(deletions))
                .build());
    }
}
