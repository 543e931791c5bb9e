package fr.lapetina.inference.gateway.security;

import fr.lapetina.inference.gateway.domain.failure.SecurityFailure;

/**
 * Rejects payloads nested deeper than the configured maximum.
 */
public final class DepthLimitCheck implements PayloadCheck {

    public static final int DEFAULT_MAX_DEPTH = 10;

    private final int maxDepth;

    public DepthLimitCheck(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0");
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public void inspectDepth(int depth) {
        if (depth > maxDepth) {
            throw new SecurityFailure("Input structure too deep: depth " + depth + " > " + maxDepth,
                    SecurityFailure.DEPTH_EXCEEDED);
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    @Override
    public String getName() {
        return "depth-limit";
    }
}
