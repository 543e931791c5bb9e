package fr.lapetina.inference.gateway.admission;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One unit of admitted capacity. Closing it releases the unit; further closes are no-ops,
 * so a token can never release more than it acquired.
 *
 * <pre>{@code
 * try (AdmissionToken token = admission.acquire()) {
 *     // expensive work
 * }
 * }</pre>
 */
public final class AdmissionToken implements AutoCloseable {

    private final ResourceAdmission owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    AdmissionToken(ResourceAdmission owner) {
        this.owner = owner;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            owner.release();
        }
    }
}
