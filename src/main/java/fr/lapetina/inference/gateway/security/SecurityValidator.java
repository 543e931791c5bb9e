package fr.lapetina.inference.gateway.security;

import fr.lapetina.inference.gateway.domain.failure.SecurityFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Depth-first, document-order walk of an untrusted payload tree.
 *
 * <p>The first violation reported by any {@link PayloadCheck} aborts the whole validation
 * with a single {@link SecurityFailure}; there is no partial success. Scalars other than
 * strings (numbers, booleans, null) are accepted as-is.
 *
 * <p>Thread-safe as long as the configured checks are stateless.
 */
public final class SecurityValidator {

    private static final Logger log = LoggerFactory.getLogger(SecurityValidator.class);

    private final List<PayloadCheck> checks;

    public SecurityValidator(List<PayloadCheck> checks) {
        if (checks.isEmpty()) {
            throw new IllegalArgumentException("At least one payload check is required");
        }
        this.checks = List.copyOf(checks);
        log.info("SecurityValidator initialized: checks={}",
                this.checks.stream().map(PayloadCheck::getName).toList());
    }

    /**
     * Creates a validator with the default depth, content, size and key checks.
     */
    public static SecurityValidator withDefaults() {
        return withLimits(
                DepthLimitCheck.DEFAULT_MAX_DEPTH,
                SizeLimitCheck.DEFAULT_MAX_STRING_LENGTH,
                SizeLimitCheck.DEFAULT_MAX_ARRAY_LENGTH
        );
    }

    public static SecurityValidator withLimits(int maxDepth, int maxStringLength, int maxArrayLength) {
        return new SecurityValidator(List.of(
                new DepthLimitCheck(maxDepth),
                ContentPatternCheck.withDefaults(),
                new SizeLimitCheck(maxStringLength, maxArrayLength),
                KeyNameCheck.withDefaults()
        ));
    }

    /**
     * Validates the payload.
     *
     * @throws SecurityFailure on the first violation found
     */
    public void validate(Object payload) {
        visit(payload, 0);
    }

    private void visit(Object node, int depth) {
        for (PayloadCheck check : checks) {
            check.inspectDepth(depth);
        }

        if (node instanceof String value) {
            for (PayloadCheck check : checks) {
                check.inspectString(value);
            }
        } else if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new SecurityFailure("Dictionary keys must be strings", SecurityFailure.INVALID_KEY);
                }
                for (PayloadCheck check : checks) {
                    check.inspectKey(key);
                }
                visit(entry.getValue(), depth + 1);
            }
        } else if (node instanceof List<?> list) {
            for (PayloadCheck check : checks) {
                check.inspectList(list);
            }
            for (Object item : list) {
                visit(item, depth + 1);
            }
        }
    }

    public List<PayloadCheck> getChecks() {
        return checks;
    }
}
