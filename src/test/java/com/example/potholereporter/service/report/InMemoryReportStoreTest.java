package com.example.potholereporter.service.report;

import com.example.potholereporter.model.Severity;
import com.example.potholereporter.model.report.AuditEntry;
import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.model.report.ReportStatus;
import com.example.potholereporter.model.user.Role;
import com.example.potholereporter.service.lifecycle.Actor;
import com.example.potholereporter.service.lifecycle.ReportLifecycle;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryReportStoreTest {

    private final InMemoryReportStore store = new InMemoryReportStore();
    private final ReportLifecycle lifecycle = new ReportLifecycle(Clock.systemUTC());

    @Test
    void findFiltersAndOrdersNewestFirst() {
        Instant base = Instant.parse("2024-05-01T00:00:00Z");
        store.insert(ReportFixtures.report("a", "u1", ReportStatus.PENDING, Severity.MINOR, base));
        store.insert(ReportFixtures.report("b", "u2", ReportStatus.PENDING, Severity.SEVERE, base.plusSeconds(10)));
        store.insert(ReportFixtures.report("c", "u1", ReportStatus.RESOLVED, Severity.MINOR, base.plusSeconds(20)));

        assertThat(store.find(ReportFilter.all(), 10)).extracting(Report::id).containsExactly("c", "b", "a");
        assertThat(store.find(new ReportFilter(ReportStatus.PENDING, null, null), 10)).extracting(Report::id)
                .containsExactly("b", "a");
        assertThat(store.find(new ReportFilter(null, Severity.MINOR, null), 10)).extracting(Report::id)
                .containsExactly("c", "a");
        assertThat(store.find(ReportFilter.ownedBy("u1"), 1)).extracting(Report::id).containsExactly("c");
    }

    @Test
    void duplicateIdIsRejected() {
        Report report = ReportFixtures.report("a", null, ReportStatus.PENDING, Severity.MINOR, Instant.now());
        store.insert(report);

        assertThatThrownBy(() -> store.insert(report)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void transitionOnMissingReportIsEmpty() {
        assertThat(store.applyTransition("missing", lifecycle.resolve("repair-done", null, null))).isEmpty();
    }

    @Test
    void concurrentActionsNeverLoseAnAuditEntry() throws Exception {
        Report original = store.insert(ReportFixtures.report("r", null, ReportStatus.PENDING, Severity.MINOR, Instant.now()));
        int threads = 16;
        int actionsPerThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                Actor actor = new Actor("officer-" + t, Role.AUTHORITY);
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < actionsPerThread; i++) {
                        store.applyTransition("r", lifecycle.resolve("schedule-repair", actor, "note " + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Report updated = store.findById("r").orElseThrow();
        assertThat(updated.audit()).hasSize(threads * actionsPerThread + 1);
        assertThat(updated.audit().get(0)).isEqualTo(original.audit().get(0));
        assertThat(updated.audit()).extracting(AuditEntry::action).filteredOn("schedule-repair"::equals)
                .hasSize(threads * actionsPerThread);
        assertThat(updated.status()).isEqualTo(ReportStatus.IN_PROGRESS);
    }
}
