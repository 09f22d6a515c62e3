package com.outreach.scoring.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.outreach.scoring.config.BulkUpdateProperties;
import com.outreach.scoring.exception.SizeLimitException;
import com.outreach.scoring.exception.ValidationException;
import com.outreach.scoring.model.bulk.BulkUpdateRequest;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a bulk-update body. The size ceiling is enforced before a single byte is parsed:
 * first against the declared length, then while reading.
 */
@Component
public class BulkRequestReader {

    private final ObjectMapper objectMapper;
    private final BulkUpdateProperties properties;

    public BulkRequestReader(ObjectMapper objectMapper, BulkUpdateProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @param declaredLength Content-Length of the request, or -1 when unknown
     */
    public BulkUpdateRequest read(InputStream body, long declaredLength) throws IOException {
        long limit = properties.getMaxRequestBytes();
        if (declaredLength > limit) {
            throw new SizeLimitException(declaredLength, limit);
        }
        byte[] bytes = body.readNBytes((int) Math.min(Integer.MAX_VALUE - 1, limit) + 1);
        if (bytes.length > limit) {
            throw new SizeLimitException(bytes.length, limit);
        }
        return parse(bytes);
    }

    public BulkUpdateRequest parse(byte[] bytes) {
        if (bytes.length > properties.getMaxRequestBytes()) {
            throw new SizeLimitException(bytes.length, properties.getMaxRequestBytes());
        }
        if (bytes.length == 0) {
            throw new ValidationException("body", "Request body is empty");
        }
        try {
            return objectMapper.readValue(bytes, BulkUpdateRequest.class);
        } catch (MismatchedInputException e) {
            String field = fieldOf(e);
            if ("identifiers".equals(field)) {
                throw new ValidationException(field, "identifiers must be an array");
            }
            if ("patch".equals(field)) {
                throw new ValidationException(field, "patch must be an object");
            }
            throw new ValidationException("body", "Request body must be a JSON object");
        } catch (JsonProcessingException e) {
            throw new ValidationException("body", "Invalid JSON in request");
        } catch (IOException e) {
            throw new ValidationException("body", "Unreadable request body");
        }
    }

    private static String fieldOf(JsonMappingException e) {
        if (e.getPath().isEmpty()) {
            return null;
        }
        String name = e.getPath().get(0).getFieldName();
        if ("filenames".equals(name)) {
            return "identifiers";
        }
        if ("updates".equals(name)) {
            return "patch";
        }
        return name;
    }
}
