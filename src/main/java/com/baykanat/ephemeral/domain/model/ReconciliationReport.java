package com.baykanat.ephemeral.domain.model;

import lombok.Builder;
import lombok.Value;

/** Tek kanal için uzlaştırma turunun özeti. */
@Value
@Builder
public class ReconciliationReport {

    long channelId;
    int scanned;
    int scheduled;
    int expired;
    int deleted;
    int pinnedCancelled;
}
