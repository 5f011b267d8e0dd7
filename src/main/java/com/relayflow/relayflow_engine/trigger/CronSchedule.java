package com.relayflow.relayflow_engine.trigger;

import com.relayflow.relayflow_engine.exception.ValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron expression bound to a time zone. Accepts 5-field crontab expressions
 * ({@code "*&#47;15 9-17 * * MON-FRI"}), which fire at second 0, and 6-field Spring
 * expressions with a leading seconds field. Next-fire computation is pure.
 */
public final class CronSchedule {

    private final String expression;
    private final CronExpression cron;
    private final ZoneId zone;

    private CronSchedule(String expression, CronExpression cron, ZoneId zone) {
        this.expression = expression;
        this.cron = cron;
        this.zone = zone;
    }

    public static CronSchedule parse(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("Cron expression is empty");
        }
        String trimmed = expression.trim();
        String normalized = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        try {
            return new CronSchedule(trimmed, CronExpression.parse(normalized), zone);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException("Invalid cron expression '" + expression + "': " + ex.getMessage());
        }
    }

    public static CronSchedule parse(String expression, String zoneId) {
        return parse(expression, zone(zoneId));
    }

    public static ZoneId zone(String zoneId) {
        try {
            return ZoneId.of(zoneId == null || zoneId.isBlank() ? "UTC" : zoneId.trim());
        } catch (DateTimeException ex) {
            throw new ValidationException("Unknown time zone '" + zoneId + "'");
        }
    }

    /** First fire time strictly after {@code after}, or null if the expression never fires again. */
    public Instant next(Instant after) {
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, zone));
        return next == null ? null : next.toInstant();
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }
}
