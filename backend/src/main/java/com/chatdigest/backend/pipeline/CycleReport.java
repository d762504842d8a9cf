package com.chatdigest.backend.pipeline;

import com.chatdigest.backend.ingest.IngestionReport;

public record CycleReport(
    IngestionReport ingestion,
    SummaryWindow window,
    int summarized,
    int emptyWindows,
    int posted,
    int alreadyHandled,
    int failed,
    int purged) {}
