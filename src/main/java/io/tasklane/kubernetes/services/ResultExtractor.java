package io.tasklane.kubernetes.services;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasklane.kubernetes.exceptions.ResultExtractionException;
import io.tasklane.kubernetes.models.ResourceResult;
import io.tasklane.kubernetes.serializers.JacksonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the result records a container writes as its termination message: a JSON array of
 * {@code {"name": ..., "digest": ...}} or {@code {"name": ..., "value": ...}} objects. Text
 * printed before the array is skipped. Either every element is valid or nothing is returned.
 */
public class ResultExtractor {
    private static final ObjectMapper MAPPER = JacksonMapper.ofJson()
        .copy()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public List<ResourceResult> extract(byte[] payload) throws ResultExtractionException {
        if (payload == null || payload.length == 0) {
            throw new ResultExtractionException("Empty result payload");
        }

        return extract(new String(payload, StandardCharsets.UTF_8));
    }

    public List<ResourceResult> extract(String payload) throws ResultExtractionException {
        if (payload == null || payload.isBlank()) {
            throw new ResultExtractionException("Empty result payload");
        }

        JsonNode array = firstArray(payload);
        if (array == null) {
            throw new ResultExtractionException("No JSON array found in result payload");
        }

        List<ResourceResult> results = new ArrayList<>();
        for (JsonNode element : array) {
            results.add(toResult(element));
        }

        return results;
    }

    private static JsonNode firstArray(String payload) {
        int index = payload.indexOf('[');

        while (index >= 0) {
            try (JsonParser parser = MAPPER.getFactory().createParser(payload.substring(index))) {
                JsonNode node = MAPPER.readTree(parser);
                if (node != null && node.isArray()) {
                    return node;
                }
            } catch (IOException e) {
                // not an array starting here, try the next bracket
            }

            index = payload.indexOf('[', index + 1);
        }

        return null;
    }

    private static ResourceResult toResult(JsonNode element) throws ResultExtractionException {
        if (!element.isObject()) {
            throw new ResultExtractionException("Invalid result record, expected an object but got '" + element + "'");
        }

        ResourceResult result;
        try {
            result = MAPPER.treeToValue(element, ResourceResult.class);
        } catch (JsonProcessingException e) {
            throw new ResultExtractionException("Invalid result record '" + element + "'", e);
        }

        if (result.getName() == null || result.getName().isEmpty()) {
            throw new ResultExtractionException("Invalid result record '" + element + "', missing name");
        }

        if (result.getDigest() == null && result.getValue() == null) {
            throw new ResultExtractionException("Invalid result record '" + element + "', missing digest or value");
        }

        return result;
    }
}
