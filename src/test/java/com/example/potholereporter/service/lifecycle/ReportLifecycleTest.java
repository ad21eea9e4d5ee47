package com.example.potholereporter.service.lifecycle;

import com.example.potholereporter.model.Severity;
import com.example.potholereporter.model.report.AuditEntry;
import com.example.potholereporter.model.report.DroneStatus;
import com.example.potholereporter.model.report.GeoPoint;
import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.model.report.ReportStatus;
import com.example.potholereporter.model.user.Role;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportLifecycleTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private final ReportLifecycle lifecycle = new ReportLifecycle(Clock.fixed(NOW, ZoneOffset.UTC));
    private final Actor officer = new Actor("officer-1", Role.AUTHORITY);

    @Test
    void knownActionsMapToTheirTargetStatus() {
        assertThat(lifecycle.resolve("notify-authority", officer, null).targetStatus()).isEqualTo(ReportStatus.REPORTED);
        assertThat(lifecycle.resolve("dispatch-drone", officer, null).targetStatus()).isEqualTo(ReportStatus.INSPECTED);
        assertThat(lifecycle.resolve("inspection-done", officer, null).targetStatus()).isEqualTo(ReportStatus.INSPECTED);
        assertThat(lifecycle.resolve("schedule-repair", officer, null).targetStatus()).isEqualTo(ReportStatus.IN_PROGRESS);
        assertThat(lifecycle.resolve("repair-done", officer, null).targetStatus()).isEqualTo(ReportStatus.RESOLVED);
        assertThat(lifecycle.resolve("notify-citizen", officer, null).targetStatus()).isNull();
        assertThat(lifecycle.resolve("assign-drone", officer, null).targetStatus()).isNull();
    }

    @Test
    void droneActionsUpdateTheDroneTag() {
        assertThat(lifecycle.resolve("assign-drone", officer, null).targetDroneStatus()).isEqualTo(DroneStatus.IN_PROGRESS);
        assertThat(lifecycle.resolve("dispatch-drone", officer, null).targetDroneStatus()).isEqualTo(DroneStatus.IN_PROGRESS);
        assertThat(lifecycle.resolve("inspection-done", officer, null).targetDroneStatus()).isEqualTo(DroneStatus.COMPLETED);
        assertThat(lifecycle.resolve("repair-done", officer, null).targetDroneStatus()).isNull();
    }

    @Test
    void actionNamesAreNormalised() {
        Transition transition = lifecycle.resolve("  Dispatch_Drone ", officer, null);

        assertThat(transition.entry().action()).isEqualTo("dispatch-drone");
        assertThat(transition.targetStatus()).isEqualTo(ReportStatus.INSPECTED);
    }

    @Test
    void unknownActionIsRecordedVerbatimWithoutStatusChange() {
        Transition transition = lifecycle.resolve("called-contractor", officer, "left voicemail");

        assertThat(transition.changesStatus()).isFalse();
        assertThat(transition.targetDroneStatus()).isNull();
        assertThat(transition.entry().action()).isEqualTo("called-contractor");
        assertThat(transition.entry().notes()).isEqualTo("left voicemail");
    }

    @Test
    void auditEntryCarriesActorAndTimestamp() {
        AuditEntry entry = lifecycle.resolve(LifecycleAction.SCHEDULE_REPAIR, officer, "  ").entry();

        assertThat(entry.actorId()).isEqualTo("officer-1");
        assertThat(entry.actorRole()).isEqualTo("authority");
        assertThat(entry.timestamp()).isEqualTo(NOW);
        assertThat(entry.notes()).isNull();
    }

    @Test
    void anonymousActorLeavesIdentityEmpty() {
        AuditEntry entry = lifecycle.resolve(LifecycleAction.UPLOAD, null, null).entry();

        assertThat(entry.actorId()).isNull();
        assertThat(entry.actorRole()).isNull();
    }

    @Test
    void blankActionIsRejected() {
        assertThatThrownBy(() -> lifecycle.resolve(" ", officer, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> lifecycle.resolve((String) null, officer, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void applyAppendsEntryAndKeepsUnchangedFields() {
        Report report = pendingReport();

        Report afterAssign = ReportLifecycle.apply(report, lifecycle.resolve("assign-drone", officer, null));
        Report afterRepair = ReportLifecycle.apply(afterAssign, lifecycle.resolve("schedule-repair", officer, null));

        assertThat(afterAssign.status()).isEqualTo(ReportStatus.PENDING);
        assertThat(afterAssign.droneStatus()).isEqualTo(DroneStatus.IN_PROGRESS);
        assertThat(afterRepair.status()).isEqualTo(ReportStatus.IN_PROGRESS);
        assertThat(afterRepair.droneStatus()).isEqualTo(DroneStatus.IN_PROGRESS);
        assertThat(afterRepair.audit()).extracting(AuditEntry::action)
                .containsExactly("upload", "assign-drone", "schedule-repair");
        assertThat(afterRepair.updatedAt()).isEqualTo(NOW);
        assertThat(report.audit()).hasSize(1);
    }

    private Report pendingReport() {
        AuditEntry upload = lifecycle.resolve(LifecycleAction.UPLOAD, null, null).entry();
        Instant created = Instant.parse("2024-04-30T08:00:00Z");
        return new Report("r-1", null, "/uploads/a.jpg", null, "MG Road", new GeoPoint(18.52, 73.85),
                1, 0.1, 0.9, Severity.MINOR, "Cold Patch Asphalt", 1, 350,
                ReportStatus.PENDING, DroneStatus.UNASSIGNED, List.of(upload), created, created);
    }
}
