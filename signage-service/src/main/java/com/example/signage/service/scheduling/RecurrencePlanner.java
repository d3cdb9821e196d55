package com.example.signage.service.scheduling;

import com.example.signage.shared.config.AppProperties;
import com.example.signage.shared.exception.InvalidRecurrenceExpressionException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Computes occurrences of a schedule's recurrence rule.
 * <p>
 * Rules are cron expressions with five fields ({@code minute hour day-of-month month day-of-week})
 * or six fields with a leading seconds field. Macros such as {@code @daily} are accepted too.
 * Evaluation happens in the zone configured by {@code signage.scheduling.zone}.
 * Stateless and deterministic for a given input.
 */
@Component
public class RecurrencePlanner {

    private final ZoneId zone;

    public RecurrencePlanner(AppProperties appProperties) {
        this.zone = ZoneId.of(appProperties.getScheduling().getZone());
    }

    /**
     * @return the first occurrence strictly after {@code after}
     * @throws InvalidRecurrenceExpressionException if the rule cannot be parsed or never fires again
     */
    public Instant nextOccurrence(String expression, Instant after) {
        CronExpression cron = parse(expression);
        ZonedDateTime next = cron.next(after.atZone(zone));
        if (next == null) {
            throw new InvalidRecurrenceExpressionException(expression, "expression has no future occurrence");
        }
        return next.toInstant();
    }

    public void validate(String expression, Instant reference) {
        nextOccurrence(expression, reference);
    }

    public ZoneId getZone() {
        return zone;
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidRecurrenceExpressionException(String.valueOf(expression), "expression is empty");
        }
        String trimmed = expression.trim();
        String normalized;
        if (trimmed.startsWith("@")) {
            normalized = trimmed;
        } else {
            int fields = trimmed.split("\\s+").length;
            if (fields == 5) {
                normalized = "0 " + trimmed;
            } else if (fields == 6) {
                normalized = trimmed;
            } else {
                throw new InvalidRecurrenceExpressionException(expression, "expected 5 or 6 fields but found " + fields);
            }
        }
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidRecurrenceExpressionException(expression, e);
        }
    }
}
