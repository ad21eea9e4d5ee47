package com.example.potholereporter.service.lifecycle;

import com.example.potholereporter.model.report.AuditEntry;
import com.example.potholereporter.model.report.Report;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Pure transition table for report lifecycle actions. The next status depends
 * only on the action, never on the current status, so stores can apply a
 * transition in a single atomic write without reading the report first.
 * Unknown actions are accepted: they are audited but change nothing.
 */
@Component
public class ReportLifecycle {

    private final Clock clock;

    public ReportLifecycle(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Transition resolve(String action, Actor actor, String notes) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Action must not be blank");
        }
        Actor effectiveActor = actor != null ? actor : Actor.anonymous();
        Optional<LifecycleAction> known = LifecycleAction.lookup(action);
        String recordedName = known.map(LifecycleAction::actionName).orElse(action.trim());
        AuditEntry entry = new AuditEntry(recordedName, effectiveActor.id(), effectiveActor.roleLabel(),
                blankToNull(notes), Instant.now(clock));
        return new Transition(entry,
                known.map(LifecycleAction::targetStatus).orElse(null),
                known.map(LifecycleAction::targetDroneStatus).orElse(null));
    }

    public Transition resolve(LifecycleAction action, Actor actor, String notes) {
        return resolve(action.actionName(), actor, notes);
    }

    public static Report apply(Report report, Transition transition) {
        return report.withAction(transition.entry(), transition.targetStatus(), transition.targetDroneStatus(),
                transition.entry().timestamp());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
