package net.cronengine.core.spi;

import java.time.Instant;
import java.util.Optional;

public interface CronEvaluator {
    boolean isValid(String cronExpr);

    /**
     * Next occurrence strictly after {@code from}.
     * Empty only when the expression can never fire.
     *
     * @throws IllegalArgumentException if the expression does not parse
     */
    Optional<Instant> next(String cronExpr, Instant from);

    /** Human-readable summary for diagnostics, never used for scheduling. */
    String describe(String cronExpr);
}
