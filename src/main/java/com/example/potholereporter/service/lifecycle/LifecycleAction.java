package com.example.potholereporter.service.lifecycle;

import com.example.potholereporter.model.report.DroneStatus;
import com.example.potholereporter.model.report.ReportStatus;

import java.util.Locale;
import java.util.Optional;

/**
 * Recognised lifecycle actions and the status changes they cause. A
 * {@code null} target means the corresponding field is left unchanged.
 */
public enum LifecycleAction {
    UPLOAD("upload", ReportStatus.PENDING, DroneStatus.UNASSIGNED),
    NOTIFY_AUTHORITY("notify-authority", ReportStatus.REPORTED, null),
    ASSIGN_DRONE("assign-drone", null, DroneStatus.IN_PROGRESS),
    DISPATCH_DRONE("dispatch-drone", ReportStatus.INSPECTED, DroneStatus.IN_PROGRESS),
    INSPECTION_DONE("inspection-done", ReportStatus.INSPECTED, DroneStatus.COMPLETED),
    SCHEDULE_REPAIR("schedule-repair", ReportStatus.IN_PROGRESS, null),
    REPAIR_DONE("repair-done", ReportStatus.RESOLVED, null),
    NOTIFY_CITIZEN("notify-citizen", null, null);

    private final String actionName;
    private final ReportStatus targetStatus;
    private final DroneStatus targetDroneStatus;

    LifecycleAction(String actionName, ReportStatus targetStatus, DroneStatus targetDroneStatus) {
        this.actionName = actionName;
        this.targetStatus = targetStatus;
        this.targetDroneStatus = targetDroneStatus;
    }

    public String actionName() {
        return actionName;
    }

    public ReportStatus targetStatus() {
        return targetStatus;
    }

    public DroneStatus targetDroneStatus() {
        return targetDroneStatus;
    }

    /**
     * Case-insensitive lookup where underscores and hyphens are interchangeable,
     * so {@code dispatch_drone} and {@code Dispatch-Drone} both resolve.
     */
    public static Optional<LifecycleAction> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (LifecycleAction action : values()) {
            if (action.actionName.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
