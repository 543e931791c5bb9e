package fr.lapetina.inference.gateway.security;

import fr.lapetina.inference.gateway.domain.failure.SecurityFailure;

import java.util.List;

/**
 * Bounds string leaf length and list length. Lists are checked before their elements are visited.
 */
public final class SizeLimitCheck implements PayloadCheck {

    public static final int DEFAULT_MAX_STRING_LENGTH = 10_000;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1_000;

    private final int maxStringLength;
    private final int maxArrayLength;

    public SizeLimitCheck(int maxStringLength, int maxArrayLength) {
        this.maxStringLength = maxStringLength;
        this.maxArrayLength = maxArrayLength;
    }

    public static SizeLimitCheck withDefaults() {
        return new SizeLimitCheck(DEFAULT_MAX_STRING_LENGTH, DEFAULT_MAX_ARRAY_LENGTH);
    }

    @Override
    public void inspectString(String value) {
        if (value.length() > maxStringLength) {
            throw new SecurityFailure("Input string too long: " + value.length() + " > " + maxStringLength,
                    SecurityFailure.STRING_TOO_LONG);
        }
    }

    @Override
    public void inspectList(List<?> list) {
        if (list.size() > maxArrayLength) {
            throw new SecurityFailure("Array too large: " + list.size() + " > " + maxArrayLength,
                    SecurityFailure.ARRAY_TOO_LARGE);
        }
    }

    @Override
    public String getName() {
        return "size-limit";
    }
}
