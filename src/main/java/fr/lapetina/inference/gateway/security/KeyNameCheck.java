package fr.lapetina.inference.gateway.security;

import fr.lapetina.inference.gateway.domain.failure.SecurityFailure;

import java.util.Set;

/**
 * Rejects mapping keys that are common trust-boundary bypass vectors in dynamically
 * dispatched object systems, whatever the downstream runtime.
 */
public final class KeyNameCheck implements PayloadCheck {

    public static final String RESERVED_PREFIX = "__";
    public static final Set<String> RESERVED_NAMES = Set.of("constructor", "prototype");

    private final String reservedPrefix;
    private final Set<String> reservedNames;

    public KeyNameCheck(String reservedPrefix, Set<String> reservedNames) {
        this.reservedPrefix = reservedPrefix;
        this.reservedNames = Set.copyOf(reservedNames);
    }

    public static KeyNameCheck withDefaults() {
        return new KeyNameCheck(RESERVED_PREFIX, RESERVED_NAMES);
    }

    @Override
    public void inspectKey(String key) {
        if (key.startsWith(reservedPrefix) || reservedNames.contains(key)) {
            throw new SecurityFailure("Dangerous key name: " + key, SecurityFailure.DANGEROUS_KEY);
        }
    }

    @Override
    public String getName() {
        return "key-name";
    }
}
