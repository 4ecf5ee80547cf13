package com.umitunal.cronq.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Properties;

/**
 * Builds a {@link CronConfig} from properties.
 *
 * Recognized keys (all optional):
 *  - cronq.lockDuration, cronq.nextDelay, cronq.reprocessDelay, cronq.idleDelay (milliseconds)
 *  - cronq.field.sleepUntil, cronq.field.interval, cronq.field.repeatUntil, cronq.field.autoRemove
 *  - cronq.timeZone
 */
public final class CronConfigLoader {

    private static final String PREFIX = "cronq.";

    private CronConfigLoader() {}

    public static CronConfig loadFromClasspath(String fileName) {
        Properties props = new Properties();

        try (InputStream in = CronConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new IllegalStateException("Config file not found on classpath: " + fileName);
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config: " + fileName, e);
        }

        return fromProperties(props);
    }

    public static CronConfig fromProperties(Properties props) {
        CronConfig.Builder builder = CronConfig.newBuilder();

        Long value = getLong(props, "lockDuration");
        if (value != null) builder.withLockDuration(value);
        value = getLong(props, "nextDelay");
        if (value != null) builder.withNextDelay(value);
        value = getLong(props, "reprocessDelay");
        if (value != null) builder.withReprocessDelay(value);
        value = getLong(props, "idleDelay");
        if (value != null) builder.withIdleDelay(value);

        String field = getString(props, "field.sleepUntil");
        if (field != null) builder.withSleepUntilField(field);
        field = getString(props, "field.interval");
        if (field != null) builder.withIntervalField(field);
        field = getString(props, "field.repeatUntil");
        if (field != null) builder.withRepeatUntilField(field);
        field = getString(props, "field.autoRemove");
        if (field != null) builder.withAutoRemoveField(field);

        String zone = getString(props, "timeZone");
        if (zone != null) {
            try {
                builder.withTimeZone(ZoneId.of(zone));
            } catch (DateTimeException e) {
                throw new IllegalStateException("Invalid value for " + PREFIX + "timeZone: " + zone, e);
            }
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid cronq configuration: " + e.getMessage(), e);
        }
    }

    private static Long getLong(Properties props, String key) {
        String value = getString(props, key);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static String getString(Properties props, String key) {
        String value = props.getProperty(PREFIX + key);
        if (value == null || value.isBlank()) return null;
        return value.trim();
    }
}
