package com.ardesk.collections.engine;

import com.ardesk.collections.model.FollowUp;
import com.ardesk.collections.model.FollowUpStatus;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Comparator;
import java.util.List;

/**
 * Places a customer's next scheduled follow-up into one time bucket relative to "now".
 * <p>
 * Weeks end on Sunday: {@code endOfWeek = today + (7 - weekdayIndex(today))} with Sunday = 0, so on a
 * Sunday the week runs to the following Sunday.
 */
@Component
public class FollowUpBucketEngine {

    private static final Comparator<FollowUp> MOST_RECENT = Comparator
            .comparing(FollowUp::getFollowUpDateTime)
            .thenComparing(FollowUp::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    public FollowUpBucket classify(LocalDateTime nextFollowUpDate, LocalDateTime now) {
        if (nextFollowUpDate == null) {
            return FollowUpBucket.NO_FOLLOW_UP;
        }

        LocalDate today = now.toLocalDate();
        LocalDate tomorrow = today.plusDays(1);
        LocalDate endOfWeek = today.plusDays(7 - weekdayIndex(today));
        LocalDate endOfMonth = today.with(TemporalAdjusters.lastDayOfMonth());
        LocalDate day = nextFollowUpDate.toLocalDate();

        if (day.isBefore(today)) {
            return FollowUpBucket.OVERDUE;
        }
        if (day.isEqual(today)) {
            return FollowUpBucket.DUE_TODAY;
        }
        if (day.isEqual(tomorrow)) {
            return FollowUpBucket.DUE_TOMORROW;
        }
        if (!day.isAfter(endOfWeek)) {
            return FollowUpBucket.DUE_THIS_WEEK;
        }
        if (!day.isAfter(endOfMonth)) {
            return FollowUpBucket.DUE_THIS_MONTH;
        }
        return FollowUpBucket.UNSCHEDULED_FUTURE;
    }

    /**
     * The most recent non-cancelled follow-up, or null. Only its next date counts for bucketing.
     */
    public FollowUp latest(List<FollowUp> followUps) {
        return followUps.stream()
                .filter(f -> f.getStatus() != FollowUpStatus.CANCELLED)
                .filter(f -> f.getFollowUpDateTime() != null)
                .max(MOST_RECENT)
                .orElse(null);
    }

    // Sunday = 0 ... Saturday = 6
    static int weekdayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }
}
