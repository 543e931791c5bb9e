package fr.lapetina.inference.gateway.admission;

import java.util.OptionalDouble;

/**
 * Reports accelerator memory pressure as a fraction in [0, 1].
 * Empty when no accelerator backend is present.
 */
@FunctionalInterface
public interface AcceleratorProbe {

    AcceleratorProbe NONE = OptionalDouble::empty;

    OptionalDouble memoryUsedFraction();
}
