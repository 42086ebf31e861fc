package com.ragguard.controller;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.ragguard.exception.ValidationException;
import com.ragguard.model.SplitReport;
import com.ragguard.model.SyncReport;
import com.ragguard.service.IngestionSyncService;
import com.ragguard.service.PdfSplitService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand ingestion: index sync and PDF splitting
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionSyncService ingestionSyncService;
    private final PdfSplitService pdfSplitService;
    private final Gson gson;

    @PostMapping(value = "/sync", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> sync() {
        log.info("Manual sync requested");
        SyncReport report = ingestionSyncService.syncDocuments();
        if (!report.isExecuted()) {
            JsonObject error = new JsonObject();
            error.addProperty("error", "Sync already in progress");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(gson.toJson(error));
        }
        return ResponseEntity.ok(gson.toJson(report));
    }

    @PostMapping(value = "/documents/split", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> split(@RequestBody String body) {
        JsonObject payload = gson.fromJson(body, JsonObject.class);
        if (payload == null || !payload.has("key") || payload.get("key").isJsonNull()) {
            throw new ValidationException("Object key is required");
        }
        SplitReport report = pdfSplitService.splitObject(payload.get("key").getAsString());
        return ResponseEntity.ok(gson.toJson(report));
    }
}
