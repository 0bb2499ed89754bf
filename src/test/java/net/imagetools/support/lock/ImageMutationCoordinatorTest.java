package net.imagetools.support.lock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.imagetools.exception.ImageBusyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageMutationCoordinatorTest {

    private ImageMutationCoordinator coordinator;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        coordinator = new ImageMutationCoordinator(Duration.ofMillis(200));
        pool = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void should_SerializeMutations_When_SameImageIsUsedConcurrently() throws Exception {
        ImageMutationCoordinator patient = new ImageMutationCoordinator(Duration.ofSeconds(10));
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(pool.submit(() -> patient.withImageLock("img-1", () -> {
                int now = inside.incrementAndGet();
                maxInside.accumulateAndGet(now, Math::max);
                sleep(2);
                inside.decrementAndGet();
                return null;
            })));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void should_RunInParallel_When_ImagesDiffer() throws Exception {
        CountDownLatch bothInside = new CountDownLatch(2);
        Future<Boolean> first = pool.submit(() -> coordinator.withImageLock("img-a", () -> arriveAndAwait(bothInside)));
        Future<Boolean> second = pool.submit(() -> coordinator.withImageLock("img-b", () -> arriveAndAwait(bothInside)));

        assertThat(first.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(second.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void should_ThrowBusy_When_LockIsNotReleasedWithinTimeout() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = pool.submit(() -> coordinator.withImageLock("img-1", () -> {
            held.countDown();
            awaitQuietly(release);
            return null;
        }));
        held.await(5, TimeUnit.SECONDS);

        assertThatThrownBy(() -> coordinator.withImageLock("img-1", () -> "never"))
            .isInstanceOf(ImageBusyException.class)
            .satisfies(error -> assertThat(((ImageBusyException) error).isRetryable()).isTrue());

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    void should_FailWithoutWaiting_When_TryLockFindsImageHeldElsewhere() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> holder = pool.submit(() -> coordinator.withImageLock("img-1", () -> {
            held.countDown();
            awaitQuietly(release);
            return null;
        }));
        held.await(5, TimeUnit.SECONDS);

        long start = System.nanoTime();
        assertThatThrownBy(() -> coordinator.tryWithImageLock("img-1", () -> "never"))
            .isInstanceOf(ImageBusyException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofMillis(150));

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    void should_ReportOwnership_When_CheckingHeldByCurrentThread() {
        assertThat(coordinator.isHeldByCurrentThread("img-1")).isFalse();

        Boolean insideResult = coordinator.withImageLock("img-1", () -> coordinator.isHeldByCurrentThread("img-1"));

        assertThat(insideResult).isTrue();
        assertThat(coordinator.isHeldByCurrentThread("img-1")).isFalse();
    }

    @Test
    void should_ReleaseLock_When_ActionThrows() {
        assertThatThrownBy(() -> coordinator.withImageLock("img-1", () -> {
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(coordinator.tryWithImageLock("img-1", () -> "free")).isEqualTo("free");
    }

    @Test
    void should_KeepSessionAndImageKeysApart_When_IdsAreEqual() {
        String result = coordinator.withSessionLock("same-id",
            () -> coordinator.tryWithImageLock("same-id", () -> "both held"));

        assertThat(result).isEqualTo("both held");
    }

    private static boolean arriveAndAwait(CountDownLatch latch) {
        latch.countDown();
        return awaitQuietly(latch);
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
