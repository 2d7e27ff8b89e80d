package com.cinegen.api.store;

import com.cinegen.api.entity.GenerationJob;
import com.cinegen.common.enums.JobKind;
import com.cinegen.common.enums.JobStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobStoreTest {

    private final InMemoryJobStore store = new InMemoryJobStore();

    private GenerationJob queued(String id, LocalDateTime createdAt) {
        return GenerationJob.builder()
                .jobId(id)
                .kind(JobKind.VIDEO)
                .prompt("a calm lake at sunrise")
                .status(JobStatus.QUEUED)
                .progress(0)
                .createdAt(createdAt)
                .build();
    }

    @Test
    void claim_onlyFromQueuedAndOnlyOnce() {
        store.create(queued("j1", LocalDateTime.now()));

        assertThat(store.claim("j1", "w1")).isTrue();
        assertThat(store.claim("j1", "w2")).isFalse();
        assertThat(store.findById("j1").get().getOwnerWorkerId()).isEqualTo("w1");
        assertThat(store.findById("j1").get().getStatus()).isEqualTo(JobStatus.PROCESSING);
    }

    @Test
    void concurrentClaimsHaveSingleWinner() throws Exception {
        store.create(queued("j1", LocalDateTime.now()));
        AtomicInteger winners = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(8);
        for (int i = 0; i < 8; i++) {
            String workerId = "w" + i;
            executor.submit(() -> {
                try {
                    start.await();
                    if (store.claim("j1", workerId)) {
                        winners.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
        assertThat(winners.get()).isEqualTo(1);
    }

    @Test
    void progressIsMonotonicAndOwnerChecked() {
        store.create(queued("j1", LocalDateTime.now()));
        store.claim("j1", "w1");

        assertThat(store.updateProgress("j1", "w1", 30, "Submitting to veo")).isTrue();
        assertThat(store.updateProgress("j1", "w1", 20, "back")).isFalse();
        assertThat(store.updateProgress("j1", "w2", 40, "intruder")).isFalse();
        assertThat(store.updateProgress("j1", "w1", 150, "over")).isTrue();

        GenerationJob job = store.findById("j1").get();
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getCurrentStep()).isEqualTo("over");
    }

    @Test
    void cancelledIsAbsorbing() {
        store.create(queued("j1", LocalDateTime.now()));
        store.claim("j1", "w1");

        assertThat(store.cancel("j1")).isTrue();
        assertThat(store.complete("j1", "w1", "gs://x.mp4", Map.of())).isFalse();
        assertThat(store.fail("j1", "w1", "INTERNAL_SERVER_ERROR: late")).isFalse();
        assertThat(store.updateProgress("j1", "w1", 90, "Finalizing")).isFalse();
        assertThat(store.cancel("j1")).isFalse();

        GenerationJob job = store.findById("j1").get();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getResultRef()).isNull();
        assertThat(job.getErrorMessage()).isNull();
    }

    @Test
    void completeSetsResultAndFullProgress() {
        store.create(queued("j1", LocalDateTime.now()));
        store.claim("j1", "w1");

        assertThat(store.complete("j1", "w2", "gs://x.mp4", Map.of())).isFalse();
        assertThat(store.complete("j1", "w1", "gs://x.mp4", Map.of("providerUsed", "veo"))).isTrue();

        GenerationJob job = store.findById("j1").get();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getResultRef()).isEqualTo("gs://x.mp4");
        assertThat(job.getErrorMessage()).isNull();
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(store.fail("j1", "w1", "late")).isFalse();
    }

    @Test
    void failFromQueuedWithoutOwner() {
        store.create(queued("j1", LocalDateTime.now()));

        assertThat(store.fail("j1", null, "INVALID_REQUEST: bad")).isTrue();
        assertThat(store.findById("j1").get().getErrorMessage()).isEqualTo("INVALID_REQUEST: bad");
    }

    @Test
    void duplicateCreateIsRejected() {
        store.create(queued("j1", LocalDateTime.now()));

        assertThatThrownBy(() -> store.create(queued("j1", LocalDateTime.now())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void findRecentIsNewestFirstWithFilterAndLimit() {
        LocalDateTime base = LocalDateTime.of(2026, 1, 1, 12, 0);
        store.create(queued("old", base));
        store.create(queued("mid", base.plusMinutes(1)));
        store.create(queued("new", base.plusMinutes(2)));
        store.cancel("mid");

        List<GenerationJob> all = store.findRecent(null, 10);
        assertThat(all).extracting(GenerationJob::getJobId).containsExactly("new", "mid", "old");
        assertThat(store.findRecent(JobStatus.QUEUED, 1)).extracting(GenerationJob::getJobId).containsExactly("new");
        assertThat(store.findRecent(JobStatus.CANCELLED, 10)).extracting(GenerationJob::getJobId).containsExactly("mid");
    }

    @Test
    void unknownJobTransitionsAreRejected() {
        assertThat(store.claim("missing", "w1")).isFalse();
        assertThat(store.cancel("missing")).isFalse();
        assertThat(store.findById("missing")).isEmpty();
    }
}
