package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.gateway.domain.failure.ErrorKind;

/**
 * Error body returned for every failed request:
 * {@code {"error": {"type", "code", "message", ...}}}.
 */
public class ErrorResponse {

    private final Detail error;

    private ErrorResponse(Detail error) {
        this.error = error;
    }

    public Detail getError() {
        return error;
    }

    /**
     * Creates a body with the kind's default code.
     */
    public static ErrorResponse of(ErrorKind kind, String message) {
        return of(kind, kind.defaultCode(), message);
    }

    public static ErrorResponse of(ErrorKind kind, String code, String message) {
        Detail detail = new Detail();
        detail.setType(kind.type());
        detail.setCode(code);
        detail.setMessage(message);
        return new ErrorResponse(detail);
    }

    public ErrorResponse withField(String field) {
        error.setField(field);
        return this;
    }

    public ErrorResponse withResourceType(String resourceType) {
        error.setResourceType(resourceType);
        return this;
    }

    /**
     * Inner {@code error} object. Variant-specific fields are omitted when null.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Detail {

        private String type;
        private String code;
        private String message;
        private String field;

        @JsonProperty("resource_type")
        private String resourceType;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getCode() { return code; }
        public void setCode(String code) { this.code = code; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }

        public String getField() { return field; }
        public void setField(String field) { this.field = field; }

        public String getResourceType() { return resourceType; }
        public void setResourceType(String resourceType) { this.resourceType = resourceType; }
    }
}
