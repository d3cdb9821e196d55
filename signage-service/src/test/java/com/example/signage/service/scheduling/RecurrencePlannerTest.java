package com.example.signage.service.scheduling;

import com.example.signage.shared.config.AppProperties;
import com.example.signage.shared.exception.InvalidRecurrenceExpressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrencePlannerTest {

    private RecurrencePlanner planner;

    @BeforeEach
    void setUp() {
        planner = new RecurrencePlanner(new AppProperties());
    }

    @Test
    void weekdayRuleFiresLaterTheSameMonday() {
        Instant next = planner.nextOccurrence("0 9 * * 1-5", Instant.parse("2026-10-19T08:00:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2026-10-19T09:00:00Z"));
    }

    @Test
    void weekdayRuleSkipsTheWeekendAfterFriday() {
        Instant next = planner.nextOccurrence("0 9 * * 1-5", Instant.parse("2026-10-23T10:00:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2026-10-26T09:00:00Z"));
    }

    @Test
    void nextOccurrenceIsStrictlyAfterTheReference() {
        Instant next = planner.nextOccurrence("*/15 * * * *", Instant.parse("2026-10-19T10:15:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2026-10-19T10:30:00Z"));
    }

    @Test
    void acceptsSixFieldRulesAndMacros() {
        Instant reference = Instant.parse("2026-10-19T10:00:00Z");

        assertThat(planner.nextOccurrence("30 0 10 * * *", reference)).isEqualTo(Instant.parse("2026-10-19T10:00:30Z"));
        assertThat(planner.nextOccurrence("@daily", reference)).isEqualTo(Instant.parse("2026-10-20T00:00:00Z"));
    }

    @Test
    void evaluatesInTheConfiguredZone() {
        AppProperties properties = new AppProperties();
        properties.getScheduling().setZone("Europe/Berlin");
        RecurrencePlanner berlin = new RecurrencePlanner(properties);

        // 09:00 in Berlin on 2026-10-19 is 07:00 UTC (CEST, UTC+2)
        Instant next = berlin.nextOccurrence("0 9 * * *", Instant.parse("2026-10-19T06:00:00Z"));

        assertThat(next).isEqualTo(Instant.parse("2026-10-19T07:00:00Z"));
    }

    @Test
    void rejectsWrongFieldCount() {
        assertThatThrownBy(() -> planner.nextOccurrence("0 9 * *", Instant.now()))
                .isInstanceOf(InvalidRecurrenceExpressionException.class)
                .hasMessageContaining("0 9 * *");
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> planner.validate("0 25 * * *", Instant.now()))
                .isInstanceOf(InvalidRecurrenceExpressionException.class);
    }

    @Test
    void rejectsBlankExpression() {
        assertThatThrownBy(() -> planner.validate("  ", Instant.now()))
                .isInstanceOf(InvalidRecurrenceExpressionException.class);
    }
}
