package com.ragguard.controller;

import com.google.gson.Gson;
import com.ragguard.exception.ValidationException;
import com.ragguard.model.GatewayRequest;
import com.ragguard.model.GatewayResponse;
import com.ragguard.service.RetrievalOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Query endpoint
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class GatewayController {

    private final RetrievalOrchestrator orchestrator;
    private final Gson gson;

    @PostMapping(value = "/query", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> query(@RequestBody String body) {
        GatewayRequest request = gson.fromJson(body, GatewayRequest.class);
        if (request == null) {
            throw new ValidationException(RetrievalOrchestrator.MISSING_QUERY_MESSAGE);
        }
        GatewayResponse response = orchestrator.handle(request);
        return ResponseEntity.ok(gson.toJson(response));
    }
}
