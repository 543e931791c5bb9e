package fr.lapetina.inference.gateway.security;

import java.util.List;

/**
 * A single rule applied while {@link SecurityValidator} walks a payload tree.
 *
 * <p>Each callback either returns normally or throws a
 * {@link fr.lapetina.inference.gateway.domain.failure.SecurityFailure}. Implementations
 * override only the callbacks they care about and must be stateless, since one instance
 * is shared by all concurrent requests.
 */
public interface PayloadCheck {

    /**
     * Called for every node before it is inspected, with its nesting depth (root is 0).
     */
    default void inspectDepth(int depth) {
    }

    /**
     * Called for every string leaf.
     */
    default void inspectString(String value) {
    }

    /**
     * Called for every mapping key, before its value is visited.
     */
    default void inspectKey(String key) {
    }

    /**
     * Called for every ordered list, before its elements are visited.
     */
    default void inspectList(List<?> list) {
    }

    /**
     * Returns the check name used in logs.
     */
    String getName();
}
