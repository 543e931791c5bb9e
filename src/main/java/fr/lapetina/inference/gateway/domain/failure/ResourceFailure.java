package fr.lapetina.inference.gateway.domain.failure;

/**
 * The gateway temporarily cannot serve the request. Retryable by the client after backoff.
 */
public final class ResourceFailure extends GatewayFailure {

    public static final String COMPUTE = "compute";
    public static final String GPU_MEMORY = "gpu_memory";
    public static final String MODEL = "model";
    public static final String BACKEND = "backend";

    private final String resourceType;

    public ResourceFailure(String message, String resourceType) {
        super(message);
        this.resourceType = resourceType;
    }

    public ResourceFailure(String message, String resourceType, Throwable cause) {
        super(message, cause);
        this.resourceType = resourceType;
    }

    public String resourceType() {
        return resourceType;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RESOURCE;
    }
}
