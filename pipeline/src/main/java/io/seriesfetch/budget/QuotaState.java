package io.seriesfetch.budget;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Point-in-time copy of the governor's counters. {@code oldestMinuteCharge} is when the oldest charge still inside
 * the rolling minute window was made, or null when the window is empty.
 */
public record QuotaState(LocalDate day,
                         int dailyRequests,
                         long dailyTokens,
                         long minuteTokens,
                         Instant oldestMinuteCharge,
                         int concurrent) {
}
