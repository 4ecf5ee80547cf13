package com.umitunal.cronq.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class CronExpressionTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    private static Optional<Instant> next(String expression, String after) {
        return CronExpression.parse(expression).next(Instant.parse(after), null, UTC);
    }

    @Test
    @DisplayName("Every-second expression returns the following whole second")
    void testEverySecond() {
        assertThat(next("* * * * * *", "2026-01-01T00:00:00.500Z"))
                .contains(Instant.parse("2026-01-01T00:00:01Z"));
        assertThat(next("* * * * * *", "2026-01-01T00:00:00Z"))
                .contains(Instant.parse("2026-01-01T00:00:01Z"));
    }

    @Test
    @DisplayName("Result is strictly after the reference even when the reference matches")
    void testStrictlyAfter() {
        assertThat(next("0 0 12 * * *", "2026-01-01T12:00:00Z"))
                .contains(Instant.parse("2026-01-02T12:00:00Z"));
    }

    @Test
    @DisplayName("Should honour steps with and without a start value")
    void testSteps() {
        assertThat(next("*/15 * * * * *", "2026-01-01T00:00:14Z"))
                .contains(Instant.parse("2026-01-01T00:00:15Z"));
        assertThat(next("5/20 * * * * *", "2026-01-01T00:00:26Z"))
                .contains(Instant.parse("2026-01-01T00:00:45Z"));
        assertThat(next("0 10-40/15 * * * *", "2026-01-01T00:26:00Z"))
                .contains(Instant.parse("2026-01-01T00:40:00Z"));
    }

    @Test
    @DisplayName("Should honour lists and ranges")
    void testListsAndRanges() {
        assertThat(next("0 0 1,13,22 * * *", "2026-01-01T02:00:00Z"))
                .contains(Instant.parse("2026-01-01T13:00:00Z"));
        assertThat(next("0 0 8-10 * * *", "2026-01-01T10:00:00Z"))
                .contains(Instant.parse("2026-01-02T08:00:00Z"));
    }

    @Test
    @DisplayName("Should skip weekends with a weekday range given by name")
    void testWeekdayNames() {
        // 2026-01-03 is a Saturday
        assertThat(next("0 30 9 * * MON-FRI", "2026-01-03T00:00:00Z"))
                .contains(Instant.parse("2026-01-05T09:30:00Z"));
    }

    @Test
    @DisplayName("Should accept month names")
    void testMonthNames() {
        assertThat(next("0 0 0 1 JAN *", "2026-06-01T00:00:00Z"))
                .contains(Instant.parse("2027-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Both 0 and 7 mean Sunday")
    void testSundayAliases() {
        Optional<Instant> zero = next("0 0 0 * * 0", "2026-01-01T00:00:00Z");
        Optional<Instant> seven = next("0 0 0 * * 7", "2026-01-01T00:00:00Z");

        assertThat(zero).contains(Instant.parse("2026-01-04T00:00:00Z"));
        assertThat(seven).isEqualTo(zero);
    }

    @Test
    @DisplayName("Weekday steps count from Sunday")
    void testWeekdayStep() {
        // */3 selects Sunday, Wednesday and Saturday; 2026-01-01 is a Thursday
        assertThat(next("0 0 0 * * */3", "2026-01-01T00:00:00Z"))
                .contains(Instant.parse("2026-01-03T00:00:00Z"));
    }

    @Test
    @DisplayName("Restricted day-of-month and day-of-week are combined with OR")
    void testDayFieldsDisjunction() {
        // 13th of the month OR any Friday; 2026-01-02 is a Friday
        assertThat(next("0 0 0 13 * 5", "2026-01-01T00:00:00Z"))
                .contains(Instant.parse("2026-01-02T00:00:00Z"));
        // day-of-week unrestricted: only the 13th
        assertThat(next("0 0 0 13 * *", "2026-01-01T00:00:00Z"))
                .contains(Instant.parse("2026-01-13T00:00:00Z"));
        // day-of-month unrestricted: only Fridays
        assertThat(next("0 0 0 ? * FRI", "2026-01-03T00:00:00Z"))
                .contains(Instant.parse("2026-01-09T00:00:00Z"));
    }

    @Test
    @DisplayName("Should find leap days years ahead")
    void testLeapDay() {
        assertThat(next("0 0 0 29 2 *", "2026-01-01T00:00:00Z"))
                .contains(Instant.parse("2028-02-29T00:00:00Z"));
    }

    @Test
    @DisplayName("Impossible dates are exhausted instead of searching forever")
    void testImpossibleDate() {
        assertThat(next("0 0 0 30 2 *", "2026-01-01T00:00:00Z")).isEmpty();
        assertThat(next("0 0 0 31 4,6,9,11 *", "2026-01-01T00:00:00Z")).isEmpty();
    }

    @Test
    @DisplayName("Ceiling is inclusive")
    void testCeiling() {
        CronExpression cron = CronExpression.parse("0 0 12 * * *");
        Instant after = Instant.parse("2026-01-01T13:00:00Z");

        assertThat(cron.next(after, Instant.parse("2026-01-02T11:59:59Z"), UTC)).isEmpty();
        assertThat(cron.next(after, Instant.parse("2026-01-02T12:00:00Z"), UTC))
                .contains(Instant.parse("2026-01-02T12:00:00Z"));
    }

    @Test
    @DisplayName("Five-field expressions fire at second zero")
    void testFiveFields() {
        assertThat(next("30 9 * * *", "2026-01-01T00:00:00Z"))
                .contains(Instant.parse("2026-01-01T09:30:00Z"));
    }

    @Test
    @DisplayName("Fields are interpreted in the given zone")
    void testZone() {
        CronExpression cron = CronExpression.parse("0 0 9 * * *");

        assertThat(cron.next(Instant.parse("2026-01-01T00:00:00Z"), null, ZoneId.of("Europe/Istanbul")))
                .contains(Instant.parse("2026-01-01T06:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "* * * *",
            "* * * * * * *",
            "60 * * * * *",
            "* 60 * * * *",
            "* * 24 * * *",
            "* * * 0 * *",
            "* * * * 13 *",
            "* * * * * 8",
            "*/0 * * * * *",
            "a * * * * *",
            "5-1 * * * * *",
            "1,,2 * * * * *",
            "? * * * * *",
            "* * * * FOO *"
    })
    @DisplayName("Should reject malformed expressions")
    void testMalformed(String expression) {
        assertThatThrownBy(() -> CronExpression.parse(expression))
                .isInstanceOf(CronParseException.class);
    }

    @Test
    @DisplayName("A day-of-month step starting with a wildcard still requires the weekday")
    void testWildcardStepIsUnrestricted() {
        // first Monday falling on the 1st, 11th, 21st or 31st
        assertThat(next("0 0 0 */10 * MON", "2026-01-01T00:00:00Z"))
                .contains(Instant.parse("2026-05-11T00:00:00Z"));
    }

    @Test
    @DisplayName("Next occurrence equals the first match found by a second-by-second scan")
    void testAgainstBruteForce() {
        Random random = new Random(20261019L);
        long window = 2 * 24 * 3600;

        for (int i = 0; i < 40; i++) {
            String[] fields = randomFields(random);
            String expression = String.join(" ", fields);
            CronExpression cron = CronExpression.parse(expression);
            Instant after = Instant.parse("2026-01-01T00:00:00Z")
                    .plusSeconds(random.nextInt(365 * 24 * 3600))
                    .plusMillis(random.nextInt(1000));

            Instant expected = null;
            Instant candidate = after.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
            Instant end = after.plusSeconds(window);
            while (!candidate.isAfter(end)) {
                if (scanMatches(fields, candidate.atZone(UTC))) {
                    expected = candidate;
                    break;
                }
                candidate = candidate.plusSeconds(1);
            }

            Optional<Instant> actual = cron.next(after, null, UTC);
            if (expected != null) {
                assertThat(actual).as(expression + " after " + after).contains(expected);
            } else {
                assertThat(actual.map(found -> found.isAfter(end)).orElse(true))
                        .as(expression + " after " + after)
                        .isTrue();
            }
        }
    }

    private static String[] randomFields(Random random) {
        return new String[] {
                randomField(random, 0, 59),
                randomField(random, 0, 59),
                randomField(random, 0, 23),
                random.nextInt(4) == 0 ? randomField(random, 1, 31) : "*",
                "*",
                random.nextInt(4) == 0 ? randomField(random, 0, 6) : "*"
        };
    }

    private static String randomField(Random random, int min, int max) {
        int span = max - min + 1;
        switch (random.nextInt(5)) {
            case 0:
                return "*";
            case 1:
                return String.valueOf(min + random.nextInt(span));
            case 2: {
                int start = min + random.nextInt(span);
                int end = start + random.nextInt(max - start + 1);
                return start + "-" + end;
            }
            case 3:
                return "*/" + (1 + random.nextInt(Math.max(1, span / 3)));
            default: {
                int a = min + random.nextInt(span);
                int b = min + random.nextInt(span);
                return a + "," + b;
            }
        }
    }

    /**
     * Plain reading of the generated grammar, one time unit at a time.
     */
    private static boolean scanMatches(String[] fields, ZonedDateTime time) {
        boolean dom = fieldMatches(fields[3], time.getDayOfMonth(), 1);
        boolean dow = fieldMatches(fields[5], time.getDayOfWeek().getValue() % 7, 0);
        boolean day = fields[3].startsWith("*") || fields[5].startsWith("*") ? dom && dow : dom || dow;
        return day
                && fieldMatches(fields[0], time.getSecond(), 0)
                && fieldMatches(fields[1], time.getMinute(), 0)
                && fieldMatches(fields[2], time.getHour(), 0)
                && fieldMatches(fields[4], time.getMonthValue(), 1);
    }

    private static boolean fieldMatches(String field, int value, int min) {
        if (field.equals("*")) {
            return true;
        }
        if (field.startsWith("*/")) {
            return (value - min) % Integer.parseInt(field.substring(2)) == 0;
        }
        for (String part : field.split(",")) {
            String[] bounds = part.split("-");
            int low = Integer.parseInt(bounds[0]);
            int high = bounds.length > 1 ? Integer.parseInt(bounds[1]) : low;
            if (value >= low && value <= high) {
                return true;
            }
        }
        return false;
    }
}
