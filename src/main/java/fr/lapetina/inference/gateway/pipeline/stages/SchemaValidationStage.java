package fr.lapetina.inference.gateway.pipeline.stages;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.domain.failure.MalformedRequestFailure;
import fr.lapetina.inference.gateway.domain.failure.SecurityFailure;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.pipeline.OperationPolicy;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import fr.lapetina.inference.gateway.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structural checks on the request body, in this order: content type, size, JSON parse,
 * non-empty body, object shape, required fields.
 *
 * <p>On success the parsed object is stored on the context for the later stages.
 *
 * <p>Jackson refuses documents nested deeper than its {@link StreamReadConstraints} allow.
 * Such a body is a nesting attack, not a syntax error, and is reported as a
 * {@link SecurityFailure}.
 */
public final class SchemaValidationStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidationStage.class);

    private static final String JSON_CONTENT_TYPE = "application/json";

    // Only used to measure the depth of a body the main parser refused
    private static final JsonFactory DEPTH_SCANNER = JsonFactory.builder()
            .streamReadConstraints(StreamReadConstraints.builder()
                    .maxNestingDepth(Integer.MAX_VALUE)
                    .build())
            .build();

    private final ObjectMapper objectMapper;
    private final int parseNestingLimit;

    public SchemaValidationStage(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        this.parseNestingLimit = this.objectMapper.getFactory().streamReadConstraints().getMaxNestingDepth();
    }

    @Override
    public GatewayResponse apply(RequestContext context, Next next) {
        OperationPolicy operation = context.operation();
        if (!operation.expectsBody()) {
            context.setPayload(Map.of());
            return next.proceed(context);
        }

        checkContentType(context.header("Content-Type"));
        checkDeclaredLength(context.header("Content-Length"), operation.maxBodyBytes());

        byte[] raw = readBody(context, operation.maxBodyBytes());
        Map<String, Object> payload = parse(raw);
        checkRequiredFields(payload, operation.requiredFields());

        context.setPayload(payload);
        return next.proceed(context);
    }

    private static void checkContentType(String contentType) {
        if (contentType == null
                || !contentType.toLowerCase(Locale.ROOT).startsWith(JSON_CONTENT_TYPE)) {
            throw new ValidationFailure("Content-Type must be application/json", "Content-Type");
        }
    }

    private static void checkDeclaredLength(String contentLength, int maxBodyBytes) {
        if (contentLength == null) {
            return;
        }
        long declared;
        try {
            declared = Long.parseLong(contentLength.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRequestFailure("Invalid Content-Length header", e);
        }
        if (declared > maxBodyBytes) {
            throw tooLarge(maxBodyBytes);
        }
    }

    private static byte[] readBody(RequestContext context, int maxBodyBytes) {
        byte[] raw;
        try {
            // One byte past the limit tells an oversized body apart without buffering all of it
            raw = context.body().readNBytes(maxBodyBytes + 1);
        } catch (IOException e) {
            throw new MalformedRequestFailure("Failed to read request body", e);
        }
        if (raw.length > maxBodyBytes) {
            throw tooLarge(maxBodyBytes);
        }
        return raw;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parse(byte[] raw) {
        if (new String(raw, StandardCharsets.UTF_8).isBlank()) {
            throw new ValidationFailure("Request body is required");
        }

        JsonNode tree;
        try {
            tree = objectMapper.readTree(raw);
        } catch (StreamConstraintsException e) {
            if (nestedBeyond(raw, parseNestingLimit)) {
                throw new SecurityFailure("Maximum nesting depth exceeded while parsing: limit "
                        + parseNestingLimit, SecurityFailure.DEPTH_EXCEEDED);
            }
            throw new MalformedRequestFailure("Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            log.debug("Rejected unparseable body: {}", e.getOriginalMessage());
            throw new MalformedRequestFailure("Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedRequestFailure("Failed to read request body", e);
        }

        if (tree == null || tree.isNull() || tree.isMissingNode()) {
            throw new ValidationFailure("Request body is required");
        }
        if (!tree.isObject()) {
            throw new MalformedRequestFailure("Request body must be a JSON object");
        }
        return objectMapper.convertValue(tree, Map.class);
    }

    /**
     * Token-level walk; keeps no tree and does not recurse.
     */
    private static boolean nestedBeyond(byte[] raw, int limit) {
        int depth = 0;
        try (JsonParser parser = DEPTH_SCANNER.createParser(raw)) {
            JsonToken token;
            while ((token = parser.nextToken()) != null) {
                if (token.isStructStart()) {
                    if (++depth > limit) {
                        return true;
                    }
                } else if (token.isStructEnd()) {
                    depth--;
                }
            }
        } catch (IOException e) {
            log.debug("Depth scan stopped on invalid JSON: {}", e.getMessage());
        }
        return false;
    }

    private static void checkRequiredFields(Map<String, Object> payload, List<String> requiredFields) {
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields) {
            if (payload.get(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            String joined = String.join(", ", missing);
            throw new ValidationFailure("Missing required fields: " + joined, joined);
        }
    }

    private static ValidationFailure tooLarge(int maxBodyBytes) {
        return new ValidationFailure("Request too large. Maximum size: " + maxBodyBytes + " bytes");
    }

    @Override
    public String getName() {
        return "schema-validation";
    }
}
