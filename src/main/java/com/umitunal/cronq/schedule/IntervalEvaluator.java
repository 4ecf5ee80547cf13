package com.umitunal.cronq.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes the next run time of a recurring job from its interval expression.
 *
 * An empty result means the job is exhausted: no occurrence exists before its
 * ceiling, or the expression is malformed. Callers treat both the same way.
 */
public class IntervalEvaluator {
    private static final Logger log = LoggerFactory.getLogger(IntervalEvaluator.class);

    private static final int MAX_CACHED_EXPRESSIONS = 1024;

    private final ZoneId zone;
    private final Map<String, CronExpression> cache = new ConcurrentHashMap<>();

    public IntervalEvaluator() {
        this(ZoneOffset.UTC);
    }

    public IntervalEvaluator(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @param expression six-field cron expression
     * @param after reference instant (exclusive)
     * @param ceiling latest acceptable occurrence (inclusive), or null
     * @return next occurrence, or empty when exhausted or malformed
     */
    public Optional<Instant> next(String expression, Instant after, Instant ceiling) {
        CronExpression cron;
        try {
            cron = parse(expression);
        } catch (CronParseException e) {
            log.warn("Treating malformed interval as exhausted: {}", e.getMessage());
            return Optional.empty();
        }
        return cron.next(after, ceiling, zone);
    }

    public ZoneId getZone() {
        return zone;
    }

    private CronExpression parse(String expression) {
        CronExpression cached = cache.get(expression == null ? "" : expression);
        if (cached != null) {
            return cached;
        }
        CronExpression parsed = CronExpression.parse(expression);
        if (cache.size() < MAX_CACHED_EXPRESSIONS) {
            cache.put(expression, parsed);
        }
        return parsed;
    }
}
