package com.fintracker.domain.model;

import lombok.Value;

@Value
public class ReminderGateDecision {

    boolean allowed;
    ReminderGateReason reason;

    public static ReminderGateDecision allow() {
        return new ReminderGateDecision(true, ReminderGateReason.OK);
    }

    public static ReminderGateDecision deny(ReminderGateReason reason) {
        return new ReminderGateDecision(false, reason);
    }
}
