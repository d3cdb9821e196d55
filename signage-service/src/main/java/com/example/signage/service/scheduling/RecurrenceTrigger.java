package com.example.signage.service.scheduling;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Instant;

/**
 * Spring {@link Trigger} that follows a recurrence rule inside an optional window.
 * Returns null once the next occurrence would fall after {@code until}, which ends the job.
 */
class RecurrenceTrigger implements Trigger {

    private final String expression;
    private final RecurrencePlanner recurrencePlanner;
    private final Instant notBefore;
    private final Instant until;

    RecurrenceTrigger(String expression, RecurrencePlanner recurrencePlanner, Instant notBefore, Instant until) {
        this.expression = expression;
        this.recurrencePlanner = recurrencePlanner;
        this.notBefore = notBefore;
        this.until = until;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant base = triggerContext.lastScheduledExecution();
        Instant lastCompletion = triggerContext.lastCompletion();
        if (base == null) {
            base = triggerContext.getClock().instant();
        } else if (lastCompletion != null && lastCompletion.isAfter(base)) {
            base = lastCompletion;
        }
        // An occurrence exactly at the window start belongs to the one-shot job
        if (notBefore != null && notBefore.isAfter(base)) {
            base = notBefore;
        }

        Instant next = recurrencePlanner.nextOccurrence(expression, base);
        if (until != null && next.isAfter(until)) {
            return null;
        }
        return next;
    }

    @Override
    public String toString() {
        return "RecurrenceTrigger[" + expression + ", until=" + until + "]";
    }
}
