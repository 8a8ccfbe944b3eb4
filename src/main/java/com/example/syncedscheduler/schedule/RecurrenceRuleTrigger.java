package com.example.syncedscheduler.schedule;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Local timer trigger driven by a {@link RecurrenceRule}.
 * A non-recurring rule yields its first occurrence and then stops.
 */
@RequiredArgsConstructor
public class RecurrenceRuleTrigger implements Trigger {

    private final RecurrenceRule rule;
    private final ZoneId zone;

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        var lastScheduled = triggerContext.lastScheduledExecution();
        if (!rule.recurs() && lastScheduled != null) {
            return null;
        }

        var base = lastScheduled != null ? lastScheduled : triggerContext.getClock().instant();
        var lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion != null && lastCompletion.isAfter(base)) {
            base = lastCompletion;
        }

        return rule.nextInvocationAfter(base.atZone(zone))
                .map(ZonedDateTime::toInstant)
                .orElse(null);
    }

    @Override
    public String toString() {
        return rule.toString();
    }
}
