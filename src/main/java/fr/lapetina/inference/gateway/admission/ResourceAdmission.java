package fr.lapetina.inference.gateway.admission;

import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Bounded-concurrency gate in front of expensive work.
 *
 * <p>The ledger is a single {@link AtomicInteger} updated with a compare-and-set loop, so
 * concurrent {@link #acquire()} calls can never push it above {@code maxConcurrent} and
 * {@link #status()} reads it without taking any lock.
 *
 * <p>Acquisition fails fast: there is no queueing.
 */
public final class ResourceAdmission {

    private static final Logger log = LoggerFactory.getLogger(ResourceAdmission.class);

    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final double DEFAULT_GPU_MEMORY_THRESHOLD = 0.9;

    // Threshold for warning about approaching capacity (percentage)
    private static final double CAPACITY_WARNING_THRESHOLD = 0.8;

    private final int maxConcurrent;
    private final double gpuMemoryThreshold;
    private final AcceleratorProbe acceleratorProbe;
    private final DoubleSupplier cpuUsagePercent;
    private final AtomicInteger activeRequests = new AtomicInteger(0);
    private volatile boolean capacityWarningLogged = false;

    public ResourceAdmission(
            int maxConcurrent,
            double gpuMemoryThreshold,
            AcceleratorProbe acceleratorProbe,
            DoubleSupplier cpuUsagePercent
    ) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be > 0");
        }
        this.maxConcurrent = maxConcurrent;
        this.gpuMemoryThreshold = gpuMemoryThreshold;
        this.acceleratorProbe = acceleratorProbe;
        this.cpuUsagePercent = cpuUsagePercent;
        log.info("ResourceAdmission initialized: maxConcurrent={}, gpuMemoryThreshold={}",
                maxConcurrent, gpuMemoryThreshold);
    }

    public ResourceAdmission(int maxConcurrent) {
        this(maxConcurrent, DEFAULT_GPU_MEMORY_THRESHOLD, AcceleratorProbe.NONE, () -> 0.0);
    }

    /**
     * Reserves one unit of capacity.
     *
     * @return a token that must be closed exactly once, on every exit path
     * @throws ResourceFailure with resource type {@code compute} at capacity, or
     *                         {@code gpu_memory} when accelerator memory is above threshold
     */
    public AdmissionToken acquire() {
        while (true) {
            int current = activeRequests.get();
            if (current >= maxConcurrent) {
                log.warn("Admission rejected: activeRequests={}/{}", current, maxConcurrent);
                throw new ResourceFailure("Too many concurrent requests", ResourceFailure.COMPUTE);
            }

            OptionalDouble gpu = acceleratorProbe.memoryUsedFraction();
            if (gpu.isPresent() && gpu.getAsDouble() > gpuMemoryThreshold) {
                log.warn("Admission rejected: gpuMemoryFraction={}, threshold={}",
                        gpu.getAsDouble(), gpuMemoryThreshold);
                throw new ResourceFailure("GPU memory threshold exceeded", ResourceFailure.GPU_MEMORY);
            }

            if (activeRequests.compareAndSet(current, current + 1)) {
                checkCapacityThreshold(current + 1);
                log.debug("Request admitted: activeRequests={}/{}", current + 1, maxConcurrent);
                return new AdmissionToken(this);
            }
        }
    }

    /**
     * Called only by {@link AdmissionToken#close()}.
     */
    void release() {
        int remaining = activeRequests.updateAndGet(v -> v > 0 ? v - 1 : 0);
        log.debug("Admission released: activeRequests={}/{}", remaining, maxConcurrent);
    }

    private void checkCapacityThreshold(int current) {
        double utilization = (double) current / maxConcurrent;
        if (utilization >= CAPACITY_WARNING_THRESHOLD && !capacityWarningLogged) {
            log.warn("Approaching admission capacity: activeRequests={}/{} ({}%)",
                    current, maxConcurrent, (int) (utilization * 100));
            capacityWarningLogged = true;
        } else if (utilization < CAPACITY_WARNING_THRESHOLD * 0.9) {
            capacityWarningLogged = false;
        }
    }

    /**
     * Snapshot for health reporting. Never mutates the ledger and never blocks.
     */
    public ResourceStatus status() {
        return new ResourceStatus(
                activeRequests.get(),
                maxConcurrent,
                cpuUsagePercent.getAsDouble(),
                acceleratorProbe.memoryUsedFraction()
        );
    }

    public int getActiveRequests() {
        return activeRequests.get();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }
}
