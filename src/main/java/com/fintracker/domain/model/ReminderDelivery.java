package com.fintracker.domain.model;

/**
 * What the notification owner does with a reminder that just fired.
 */
public enum ReminderDelivery {
    SHOW,
    SUPPRESS
}
