package com.labshare.backend.modules.auth.application;

public record CleanupResult(int sessionsDeleted, int authCodesDeleted, boolean skipped) {

    static CleanupResult skippedRun() {
        return new CleanupResult(0, 0, true);
    }

    static CleanupResult empty() {
        return new CleanupResult(0, 0, false);
    }
}
