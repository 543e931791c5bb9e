package fr.lapetina.inference.gateway.admission;

import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceAdmissionTest {

    @Test
    @DisplayName("should admit up to capacity then reject with a compute failure")
    void shouldRejectAtCapacity() {
        ResourceAdmission admission = new ResourceAdmission(2);

        AdmissionToken first = admission.acquire();
        AdmissionToken second = admission.acquire();

        assertThatThrownBy(admission::acquire)
                .isInstanceOf(ResourceFailure.class)
                .hasMessage("Too many concurrent requests")
                .satisfies(e -> assertThat(((ResourceFailure) e).resourceType())
                        .isEqualTo(ResourceFailure.COMPUTE));
        assertThat(admission.getActiveRequests()).isEqualTo(2);

        first.close();
        AdmissionToken third = admission.acquire();
        assertThat(admission.getActiveRequests()).isEqualTo(2);

        second.close();
        third.close();
        assertThat(admission.getActiveRequests()).isZero();
    }

    @Test
    @DisplayName("should release capacity exactly once per token")
    void shouldReleaseOnce() {
        ResourceAdmission admission = new ResourceAdmission(2);
        AdmissionToken held = admission.acquire();
        AdmissionToken token = admission.acquire();

        token.close();
        token.close();

        assertThat(token.isReleased()).isTrue();
        assertThat(admission.getActiveRequests()).isEqualTo(1);
        held.close();
    }

    @Test
    @DisplayName("should release capacity when the guarded work throws")
    void shouldReleaseOnFailure() {
        ResourceAdmission admission = new ResourceAdmission(1);

        assertThatThrownBy(() -> {
            try (AdmissionToken ignored = admission.acquire()) {
                throw new IllegalStateException("boom");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(admission.getActiveRequests()).isZero();
        admission.acquire().close();
    }

    @Test
    @DisplayName("should reject when accelerator memory is above threshold")
    void shouldRejectOnGpuMemory() {
        ResourceAdmission admission = new ResourceAdmission(
                4, 0.9, () -> OptionalDouble.of(0.95), () -> 12.5);

        assertThatThrownBy(admission::acquire)
                .isInstanceOf(ResourceFailure.class)
                .hasMessage("GPU memory threshold exceeded")
                .satisfies(e -> assertThat(((ResourceFailure) e).resourceType())
                        .isEqualTo(ResourceFailure.GPU_MEMORY));
        assertThat(admission.getActiveRequests()).isZero();
    }

    @Test
    @DisplayName("should report status without changing the ledger")
    void shouldReportStatus() {
        ResourceAdmission admission = new ResourceAdmission(
                1, 0.9, AcceleratorProbe.NONE, () -> 42.0);
        AdmissionToken token = admission.acquire();

        ResourceStatus status = admission.status();

        assertThat(status.activeRequests()).isEqualTo(1);
        assertThat(status.maxConcurrent()).isEqualTo(1);
        assertThat(status.atCapacity()).isTrue();
        assertThat(status.toMap())
                .containsEntry("active_requests", 1)
                .containsEntry("max_concurrent", 1)
                .containsEntry("cpu_usage_percent", 42.0)
                .containsEntry("gpu_available", false);
        assertThat(admission.getActiveRequests()).isEqualTo(1);
        token.close();
    }

    @Test
    @DisplayName("should never exceed capacity under concurrent acquisition")
    void shouldHoldCapacityUnderConcurrency() throws Exception {
        int capacity = 5;
        ResourceAdmission admission = new ResourceAdmission(capacity);
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger inside = new AtomicInteger();
        ConcurrentLinkedQueue<Integer> observed = new ConcurrentLinkedQueue<>();
        AtomicInteger rejected = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try (AdmissionToken ignored = admission.acquire()) {
                        observed.add(inside.incrementAndGet());
                        Thread.sleep(1);
                        inside.decrementAndGet();
                    } catch (ResourceFailure e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(observed).allSatisfy(n -> assertThat(n).isLessThanOrEqualTo(capacity));
        assertThat(observed.size() + rejected.get()).isEqualTo(200);
        assertThat(admission.getActiveRequests()).isZero();
    }
}
