package io.cronops.core.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.cronops.core.error.ValidationException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.List;
import java.util.Optional;

/**
 * A parsed cron expression bound to an IANA zone.
 *
 * <p>Matching happens on local wall-clock time. A local time that falls into a spring-forward
 * gap fires at the first instant after the gap; a local time that occurs twice during a
 * fall-back overlap fires only at its first occurrence.
 */
public final class CronSchedule {
    private static final CronParser UNIX_PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER =
        new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private final String expression;
    private final ZoneId zone;
    private final ExecutionTime executionTime;

    private CronSchedule(String expression, ZoneId zone, ExecutionTime executionTime) {
        this.expression = expression;
        this.zone = zone;
        this.executionTime = executionTime;
    }

    public static CronSchedule parse(String expression, String timezone) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new ValidationException("cronExpression is required");
        }
        ZoneId zone = parseZone(timezone);
        int fields = expr.split("\\s+").length;
        CronParser parser;
        if (fields == 5) {
            parser = UNIX_PARSER;
        } else if (fields == 6) {
            parser = SECONDS_PARSER;
        } else {
            throw new ValidationException("cronExpression must have 5 fields (or 6 with leading seconds): " + expr);
        }
        try {
            Cron cron = parser.parse(expr);
            cron.validate();
            return new CronSchedule(expr, zone, ExecutionTime.forCron(cron));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid cronExpression '" + expr + "': " + e.getMessage());
        }
    }

    public static ZoneId parseZone(String timezone) {
        String raw = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
        try {
            return ZoneId.of(raw);
        } catch (DateTimeException e) {
            throw new ValidationException("unknown timezone: " + raw);
        }
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Returns the first firing instant strictly after {@code after}, or empty when the
     * expression never matches again.
     */
    public Optional<Instant> nextAfter(Instant after) {
        LocalDateTime cursor = startCursor(after);
        return executionTime.nextExecution(cursor.atZone(ZoneOffset.UTC))
            .map(next -> toInstant(next.toLocalDateTime()));
    }

    private LocalDateTime startCursor(Instant after) {
        ZoneRules rules = zone.getRules();
        LocalDateTime local = LocalDateTime.ofInstant(after, zone);
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.size() > 1 && rules.getOffset(after).equals(offsets.get(1))) {
            // second pass through a fall-back overlap: every local time in it already fired
            ZoneOffsetTransition overlap = rules.getTransition(local);
            return overlap.getDateTimeBefore().minusSeconds(1);
        }
        return local;
    }

    private Instant toInstant(LocalDateTime local) {
        ZoneRules rules = zone.getRules();
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.isEmpty()) {
            ZoneOffsetTransition gap = rules.getTransition(local);
            return gap.getInstant();
        }
        // earlier offset first: the first occurrence of an overlapped local time
        return local.toInstant(offsets.get(0));
    }

    @Override
    public String toString() {
        return expression + " @ " + zone;
    }
}
