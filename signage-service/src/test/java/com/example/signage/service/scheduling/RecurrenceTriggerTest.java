package com.example.signage.service.scheduling;

import com.example.signage.shared.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RecurrenceTriggerTest {

    private final RecurrencePlanner planner = new RecurrencePlanner(new AppProperties());

    private static SimpleTriggerContext contextAt(String now) {
        return new SimpleTriggerContext(Clock.fixed(Instant.parse(now), ZoneOffset.UTC));
    }

    @Test
    void firstExecutionFollowsTheClock() {
        RecurrenceTrigger trigger = new RecurrenceTrigger("0 * * * *", planner, null, null);

        assertThat(trigger.nextExecution(contextAt("2026-10-19T10:20:00Z")))
                .isEqualTo(Instant.parse("2026-10-19T11:00:00Z"));
    }

    @Test
    void skipsAnOccurrenceExactlyAtTheWindowStart() {
        RecurrenceTrigger trigger = new RecurrenceTrigger("0 * * * *", planner,
                Instant.parse("2026-10-20T08:00:00Z"), null);

        assertThat(trigger.nextExecution(contextAt("2026-10-19T10:20:00Z")))
                .isEqualTo(Instant.parse("2026-10-20T09:00:00Z"));
    }

    @Test
    void waitsForTheWindowStartBetweenOccurrences() {
        RecurrenceTrigger trigger = new RecurrenceTrigger("0 * * * *", planner,
                Instant.parse("2026-10-20T08:15:00Z"), null);

        assertThat(trigger.nextExecution(contextAt("2026-10-19T10:20:00Z")))
                .isEqualTo(Instant.parse("2026-10-20T09:00:00Z"));
    }

    @Test
    void advancesFromTheLastScheduledExecution() {
        RecurrenceTrigger trigger = new RecurrenceTrigger("0 * * * *", planner,
                Instant.parse("2026-10-19T08:00:00Z"), null);
        SimpleTriggerContext context = contextAt("2026-10-19T08:00:00Z");
        Instant first = Instant.parse("2026-10-19T09:00:00Z");
        context.update(first, first, first.plusMillis(5));

        assertThat(trigger.nextExecution(context)).isEqualTo(Instant.parse("2026-10-19T10:00:00Z"));
    }

    @Test
    void stopsAfterTheWindowEnd() {
        RecurrenceTrigger trigger = new RecurrenceTrigger("0 * * * *", planner, null,
                Instant.parse("2026-10-19T11:30:00Z"));
        SimpleTriggerContext context = contextAt("2026-10-19T10:20:00Z");

        assertThat(trigger.nextExecution(context)).isEqualTo(Instant.parse("2026-10-19T11:00:00Z"));

        Instant last = Instant.parse("2026-10-19T11:00:00Z");
        context.update(last, last, last);
        assertThat(trigger.nextExecution(context)).isNull();
    }
}
