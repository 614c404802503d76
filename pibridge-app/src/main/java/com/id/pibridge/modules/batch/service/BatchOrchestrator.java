package com.id.pibridge.modules.batch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.id.pibridge.exceptions.BatchTransportException;
import com.id.pibridge.modules.batch.logic.ResponseClassifier;
import com.id.pibridge.modules.batch.model.BatchResponse;
import com.id.pibridge.modules.batch.model.BatchSubRequest;
import com.id.pibridge.modules.query.model.ProcessedQuery;
import com.id.pibridge.modules.webapi.service.PiWebApiClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class BatchOrchestrator {

    private final PiWebApiClient piWebApiClient;
    private final ResponseClassifier responseClassifier;

    public BatchOrchestrator(PiWebApiClient piWebApiClient, ResponseClassifier responseClassifier) {
        this.piWebApiClient = piWebApiClient;
        this.responseClassifier = responseClassifier;
    }

    /**
     * Sends the resolved entries of one RefID as a single batch call. Entries are keyed by their position in
     * {@code processed}; unresolved entries are left out.
     *
     * @return classified sub-responses by position, empty when nothing was resolved
     * @throws BatchTransportException when the call fails or the response envelope cannot be decoded
     */
    public Map<Integer, BatchResponse> executeRefId(String refId, List<ProcessedQuery> processed) {
        Map<String, BatchSubRequest> batchRequest = new LinkedHashMap<>();
        for (int i = 0; i < processed.size(); i++) {
            var query = processed.get(i);
            if (query.isResolved()) {
                batchRequest.put(String.valueOf(i), query.getBatchRequest());
            }
        }
        if (batchRequest.isEmpty()) {
            return Map.of();
        }

        String body;
        try {
            log.debug("Sending batch for RefID {} with {} sub-requests", refId, batchRequest.size());
            body = piWebApiClient.postBatch(batchRequest);
        } catch (RestClientException e) {
            throw new BatchTransportException("Batch call failed for RefID %s: %s".formatted(refId, e.getMessage()), e);
        }
        if (body == null || body.isBlank()) {
            throw new BatchTransportException("Empty batch response for RefID %s".formatted(refId));
        }

        JsonNode root;
        try {
            root = piWebApiClient.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BatchTransportException("Malformed batch response for RefID %s".formatted(refId), e);
        }
        return demultiplex(refId, root);
    }

    /**
     * Copies responses onto the entries at the matching positions. Resolved entries with no response are marked
     * as unanswered.
     */
    public static void apply(List<ProcessedQuery> processed, Map<Integer, BatchResponse> responses) {
        for (int i = 0; i < processed.size(); i++) {
            var query = processed.get(i);
            if (!query.isResolved()) {
                continue;
            }
            var response = responses.get(i);
            if (response == null) {
                query.setFailure("No response for sub-request %d".formatted(i));
                continue;
            }
            query.setResponse(response);
        }
    }

    public static void markFailed(List<ProcessedQuery> processed, String message) {
        processed.stream()
                .filter(ProcessedQuery::isResolved)
                .forEach(query -> query.setFailure(message));
    }

    private Map<Integer, BatchResponse> demultiplex(String refId, JsonNode root) {
        if (!root.isObject()) {
            throw new BatchTransportException("Batch response for RefID %s is not an object".formatted(refId));
        }
        Map<Integer, BatchResponse> responses = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            int index;
            try {
                index = Integer.parseInt(field.getKey());
            } catch (NumberFormatException e) {
                throw new BatchTransportException("Unexpected batch response key '%s' for RefID %s".formatted(field.getKey(), refId), e);
            }
            responses.put(index, responseClassifier.classify(field.getValue()));
        }
        return responses;
    }
}
