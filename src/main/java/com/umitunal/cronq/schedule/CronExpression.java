package com.umitunal.cronq.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Six-field cron expression: second, minute, hour, day-of-month, month, day-of-week.
 *
 * Field syntax and the calendar search come from Spring's
 * {@link org.springframework.scheduling.support.CronExpression}: {@code *}, values, ranges,
 * steps, lists, month and weekday names, 0 or 7 for Sunday. Five-field expressions are
 * accepted with an implicit second of 0. {@code ?} is only allowed in the day fields.
 *
 * Spring requires day-of-month and day-of-week to both match. Here, when both are
 * restricted (neither starts with {@code *} nor is {@code ?}), a day matches if either
 * field matches. Such expressions are evaluated as two alternatives, one per day field,
 * and the earlier result wins.
 *
 * Instances are immutable and thread-safe.
 */
public final class CronExpression {

    /**
     * Upper bound for the forward search, in calendar years past the reference instant.
     * Eight years covers the longest gap between two leap days (e.g. 2096 to 2104).
     */
    static final int MAX_SEARCH_YEARS = 8;

    private static final int DAY_OF_MONTH = 3;
    private static final int DAY_OF_WEEK = 5;
    private static final Pattern FIELD = Pattern.compile("[0-9A-Za-z*?/-]+(,[0-9A-Za-z*?/-]+)*");

    private final String expression;
    private final List<org.springframework.scheduling.support.CronExpression> alternatives;

    private CronExpression(String expression,
                           List<org.springframework.scheduling.support.CronExpression> alternatives) {
        this.expression = expression;
        this.alternatives = alternatives;
    }

    /**
     * Parse an expression.
     *
     * @throws CronParseException if the expression is malformed
     */
    public static CronExpression parse(String expression) {
        if (expression == null) {
            throw new CronParseException("null", "Expression is null");
        }
        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            throw new CronParseException(expression, "Expression is empty");
        }

        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            String[] withSeconds = new String[6];
            withSeconds[0] = "0";
            System.arraycopy(fields, 0, withSeconds, 1, 5);
            fields = withSeconds;
        } else if (fields.length != 6) {
            throw new CronParseException(expression, "Expected 6 fields but found " + fields.length);
        }

        for (int i = 0; i < fields.length; i++) {
            if (!FIELD.matcher(fields[i]).matches()) {
                throw new CronParseException(expression, "Invalid field '" + fields[i] + "'");
            }
            if (fields[i].contains("?") && i != DAY_OF_MONTH && i != DAY_OF_WEEK) {
                throw new CronParseException(expression, "'?' is only allowed in day fields");
            }
        }

        List<org.springframework.scheduling.support.CronExpression> alternatives = new ArrayList<>(2);
        try {
            if (isRestricted(fields[DAY_OF_MONTH]) && isRestricted(fields[DAY_OF_WEEK])) {
                alternatives.add(compile(fields, DAY_OF_WEEK));
                alternatives.add(compile(fields, DAY_OF_MONTH));
            } else {
                alternatives.add(compile(fields, -1));
            }
        } catch (IllegalArgumentException e) {
            throw new CronParseException(expression, String.valueOf(e.getMessage()), e);
        }
        return new CronExpression(expression, List.copyOf(alternatives));
    }

    /**
     * Find the earliest instant strictly after {@code after} selected by this expression.
     *
     * @param after reference instant (exclusive)
     * @param ceiling latest acceptable result (inclusive), or null for no ceiling
     * @param zone zone in which the fields are interpreted
     * @return the next matching instant, or empty if none exists before the ceiling or the search bound
     */
    public Optional<Instant> next(Instant after, Instant ceiling, ZoneId zone) {
        ZonedDateTime start = after.atZone(zone);
        ZonedDateTime earliest = null;
        for (org.springframework.scheduling.support.CronExpression cron : alternatives) {
            ZonedDateTime candidate = cron.next(start);
            if (candidate != null && (earliest == null || candidate.isBefore(earliest))) {
                earliest = candidate;
            }
        }

        if (earliest == null || earliest.getYear() > start.getYear() + MAX_SEARCH_YEARS) {
            return Optional.empty();
        }
        Instant result = earliest.toInstant();
        if (ceiling != null && result.isAfter(ceiling)) {
            return Optional.empty();
        }
        return Optional.of(result);
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return "CronExpression{" + expression + "}";
    }

    private static boolean isRestricted(String field) {
        return !field.startsWith("*") && !field.equals("?");
    }

    /**
     * Spring steps a weekday wildcard through 1-7 (Monday first); cron steps it through 0-7.
     */
    private static String stepWeekdaysFromSunday(String field) {
        String[] parts = field.split(",");
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].startsWith("*/")) {
                parts[i] = "0-7" + parts[i].substring(1);
            }
        }
        return String.join(",", parts);
    }

    /**
     * Build a Spring expression from the fields, with the field at {@code wildcard} replaced by {@code *}.
     */
    private static org.springframework.scheduling.support.CronExpression compile(String[] fields, int wildcard) {
        String[] copy = fields.clone();
        copy[DAY_OF_WEEK] = stepWeekdaysFromSunday(copy[DAY_OF_WEEK]);
        if (wildcard >= 0) {
            copy[wildcard] = "*";
        }
        return org.springframework.scheduling.support.CronExpression.parse(String.join(" ", copy));
    }
}
