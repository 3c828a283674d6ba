package net.cronengine.integration.spring.cron;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronUtilsEvaluatorTest {

    final CronUtilsEvaluator cron = new CronUtilsEvaluator();

    @Test
    void everyMinute_isExclusiveOfFrom() {
        Instant t = Instant.parse("2026-01-01T12:00:00Z");

        assertThat(cron.next("* * * * *", t)).contains(Instant.parse("2026-01-01T12:01:00Z"));
    }

    @Test
    void everyFifteenMinutes() {
        assertThat(cron.next("*/15 * * * *", Instant.parse("2026-01-01T12:03:00Z")))
                .contains(Instant.parse("2026-01-01T12:15:00Z"));
    }

    @Test
    void dailyAtNine_pastNine_rollsToNextDay() {
        assertThat(cron.next("0 9 * * *", Instant.parse("2026-01-01T12:01:00Z")))
                .contains(Instant.parse("2026-01-02T09:00:00Z"));
    }

    @Test
    void feedingOutputBack_advancesMonotonically() {
        Instant t = Instant.parse("2026-01-01T12:00:00Z");
        Instant a = cron.next("*/15 * * * *", t).orElseThrow();
        Instant b = cron.next("*/15 * * * *", a).orElseThrow();
        Instant c = cron.next("*/15 * * * *", b).orElseThrow();

        assertThat(a).isEqualTo(Instant.parse("2026-01-01T12:15:00Z"));
        assertThat(b).isEqualTo(Instant.parse("2026-01-01T12:30:00Z"));
        assertThat(c).isEqualTo(Instant.parse("2026-01-01T12:45:00Z"));
    }

    @Test
    void subMinuteFrom_stillLandsOnNextBoundary() {
        assertThat(cron.next("* * * * *", Instant.parse("2026-01-01T12:00:59.500Z")))
                .contains(Instant.parse("2026-01-01T12:01:00Z"));
    }

    @Test
    void configuredZone_isUsedForEvaluation() {
        var seoul = new CronUtilsEvaluator(ZoneId.of("Asia/Seoul"));

        // 09:00 KST = 00:00 UTC
        assertThat(seoul.next("0 9 * * *", Instant.parse("2026-01-01T12:00:00Z")))
                .contains(Instant.parse("2026-01-02T00:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "not a cron", "* * *", "60 * * * *", "* 24 * * *", "* * * * * *"})
    void isValid_rejects(String expr) {
        assertThat(cron.isValid(expr)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"* * * * *", "*/15 * * * *", "0 9 * * 1-5", "0 0 1 * *"})
    void isValid_accepts(String expr) {
        assertThat(cron.isValid(expr)).isTrue();
    }

    @Test
    void isValid_rejectsNull() {
        assertThat(cron.isValid(null)).isFalse();
    }

    @Test
    void next_invalidExpression_throws() {
        assertThatThrownBy(() -> cron.next("not a cron", Instant.EPOCH)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void describe() {
        assertThat(cron.describe("* * * * *")).matches("Next: \\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:00 UTC");
        assertThat(cron.describe("bogus")).isEqualTo("Invalid cron expression");
    }

    @Test
    void parseCache_isBounded() {
        CronExpressions.invalidateAll();
        for (int m = 0; m < 60; m++) {
            for (int h = 0; h < 6; h++) {
                CronExpressions.executionTime(m + " " + h + " * * *");
            }
        }
        assertThat(CronExpressions.cacheSize()).isEqualTo(CronExpressions.CACHE_SIZE);
    }
}
