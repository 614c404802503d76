package com.id.pibridge.modules.batch.logic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.pibridge.modules.batch.model.BatchResponse;
import com.id.pibridge.modules.batch.model.ErrorContent;
import com.id.pibridge.modules.batch.model.FlatItemsContent;
import com.id.pibridge.modules.batch.model.NestedItemsContent;
import com.id.pibridge.modules.batch.model.PiBatchContent;
import com.id.pibridge.modules.batch.model.PiBatchContentItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes one batch sub-response. The PI Web API gives no type tag for the content, so the shape is sniffed:
 * <ul>
 *     <li>status other than 200: {@link ErrorContent} built from {@code Content.Errors}</li>
 *     <li>{@code Content.Items[0]} without a {@code WebId}: {@link FlatItemsContent}</li>
 *     <li>{@code Content.Items[0]} with a {@code WebId}: {@link NestedItemsContent}</li>
 *     <li>anything else: {@link ErrorContent#unprocessable()}</li>
 * </ul>
 */
@Component
public class ResponseClassifier {

    private static final int STATUS_OK = 200;

    private final ObjectMapper objectMapper;

    public ResponseClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public BatchResponse classify(JsonNode subResponse) {
        if (subResponse == null || !subResponse.isObject()) {
            return new BatchResponse(0, Map.of(), ErrorContent.unprocessable());
        }
        int status = subResponse.path("Status").asInt(0);
        var headers = readHeaders(subResponse.path("Headers"));
        return new BatchResponse(status, headers, classifyContent(status, subResponse.path("Content")));
    }

    public PiBatchContent classifyContent(int status, JsonNode content) {
        if (status != STATUS_OK) {
            return ErrorContent.remote(readErrors(status, content));
        }
        if (content == null || !content.isObject()) {
            return ErrorContent.unprocessable();
        }

        var items = content.get("Items");
        if (items == null || !items.isArray()) {
            return ErrorContent.unprocessable();
        }
        if (items.isEmpty()) {
            return new FlatItemsContent(text(content, "UnitsAbbreviation"), List.of());
        }

        var first = items.get(0);
        if (!first.isObject()) {
            return ErrorContent.unprocessable();
        }

        try {
            var webId = first.get("WebId");
            if (webId == null || !webId.isTextual()) {
                return new FlatItemsContent(text(content, "UnitsAbbreviation"), readItems(items));
            }

            var subItems = first.get("Items");
            if (subItems != null && !subItems.isNull() && !subItems.isArray()) {
                return ErrorContent.unprocessable();
            }
            return new NestedItemsContent(
                    webId.asText(),
                    text(first, "Name"),
                    text(first, "Path"),
                    text(first, "UnitsAbbreviation"),
                    subItems == null || subItems.isNull() ? List.of() : readItems(subItems)
            );
        } catch (IllegalArgumentException e) {
            return ErrorContent.unprocessable();
        }
    }

    private List<PiBatchContentItem> readItems(JsonNode array) {
        List<PiBatchContentItem> items = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            if (node == null || node.isNull()) {
                continue;
            }
            if (!node.isObject()) {
                throw new IllegalArgumentException("Item is not an object: " + node.getNodeType());
            }
            items.add(objectMapper.convertValue(node, PiBatchContentItem.class));
        }
        return items;
    }

    private static List<String> readErrors(int status, JsonNode content) {
        List<String> errors = new ArrayList<>();
        if (content != null) {
            var errorNode = content.path("Errors");
            if (errorNode.isArray()) {
                errorNode.forEach(e -> errors.add(e.asText()));
            } else if (content.isTextual()) {
                errors.add(content.asText());
            }
        }
        if (errors.isEmpty()) {
            errors.add("PI Web API returned status %d".formatted(status));
        }
        return errors;
    }

    private static Map<String, String> readHeaders(JsonNode headersNode) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (headersNode != null && headersNode.isObject()) {
            headersNode.fields().forEachRemaining(entry -> {
                if (!entry.getValue().isNull()) {
                    headers.put(entry.getKey(), entry.getValue().asText());
                }
            });
        }
        return headers;
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }
}
