package com.fintracker.domain.model;

public enum ReminderGateReason {

    OK("ok"),
    DISABLED("disabled"),
    PERMISSION_DENIED("permission_denied"),
    SAME_LOCAL_DAY("same_local_day"),
    SPACING_NOT_ELAPSED("spacing_not_elapsed"),
    INSIDE_QUIET_HOURS("inside_quiet_hours");

    private final String code;

    ReminderGateReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
