package net.cronengine.integration.spring.cron;

import com.cronutils.model.time.ExecutionTime;
import net.cronengine.core.spi.CronEvaluator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/** {@link CronEvaluator} over cron-utils, evaluated in a fixed zone (UTC unless configured). */
public final class CronUtilsEvaluator implements CronEvaluator {
    static final String INVALID = "Invalid cron expression";
    static final String NONE = "No upcoming occurrence";
    private static final DateTimeFormatter DESCRIBE_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ZoneId zone;

    public CronUtilsEvaluator() {
        this(ZoneOffset.UTC);
    }

    public CronUtilsEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone);
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public boolean isValid(String cronExpr) {
        try {
            CronExpressions.parse(cronExpr);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public Optional<Instant> next(String cronExpr, Instant from) {
        Objects.requireNonNull(from, "from");
        ExecutionTime et = CronExpressions.executionTime(cronExpr);
        ZonedDateTime base = from.atZone(zone);
        Optional<ZonedDateTime> next = et.nextExecution(base);
        // strictly after from, even if the library returns a match equal to it
        if (next.isPresent() && !next.get().toInstant().isAfter(from)) {
            next = et.nextExecution(base.plusSeconds(1));
        }
        return next.map(ZonedDateTime::toInstant);
    }

    @Override
    public String describe(String cronExpr) {
        if (!isValid(cronExpr)) return INVALID;
        return next(cronExpr, Instant.now())
                .map(i -> "Next: " + DESCRIBE_FMT.format(i.atZone(ZoneOffset.UTC)) + " UTC")
                .orElse(NONE);
    }
}
