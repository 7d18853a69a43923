package com.fintracker.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reminder settings chosen by the user. Times are HH:MM device local; quiet hours are
 * disabled when either bound is null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderPreferences {

    private boolean remindersEnabled;
    private String preferredTimeLocal;
    private String quietHoursStart;
    private String quietHoursEnd;
}
