package com.example.potholereporter.security;

import com.example.potholereporter.model.report.Report;
import org.springframework.security.access.AccessDeniedException;

/**
 * Owner checks that cannot be expressed as a role rule: citizens may only see
 * their own reports, authorities see everything.
 */
public final class ReportAccessPolicy {

    private ReportAccessPolicy() {
    }

    public static void checkCanRead(Report report, AuthenticatedUser user) {
        if (user.isAuthority()) {
            return;
        }
        if (report.ownerId() == null || !report.ownerId().equals(user.id())) {
            throw new AccessDeniedException("Report " + report.id() + " belongs to another user");
        }
    }

    public static void checkCanListFor(String userId, AuthenticatedUser user) {
        if (!user.isAuthority() && !user.id().equals(userId)) {
            throw new AccessDeniedException("Cannot list reports of another user");
        }
    }
}
