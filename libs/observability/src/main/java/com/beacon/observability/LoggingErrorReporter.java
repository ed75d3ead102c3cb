package com.beacon.observability;

import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ErrorReporter}: logs through SLF4J and counts reports in Micrometer.
 * <p>
 * Fatal reports are logged at ERROR with the stack trace, recovered ones at WARN. Both increment
 * {@value #METRIC_ERRORS} tagged with {@code fatal=true|false}. An optional delegate receives every
 * report afterwards, e.g. to forward it to a crash reporter.
 */
public final class LoggingErrorReporter implements ErrorReporter {

    /** Counter incremented for every report. */
    public static final String METRIC_ERRORS = "beacon.errors.reported";

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorReporter.class);

    private final Counter fatalCounter;
    private final Counter recoveredCounter;
    private final ErrorReporter delegate;

    public LoggingErrorReporter(MetricFactory metrics) {
        this(metrics, null);
    }

    /**
     * @param metrics  factory for the report counters
     * @param delegate reporter called after logging; may be {@code null}
     */
    public LoggingErrorReporter(MetricFactory metrics, ErrorReporter delegate) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.fatalCounter = metrics.counter(METRIC_ERRORS, "Internal errors reported", "fatal", "true");
        this.recoveredCounter = metrics.counter(METRIC_ERRORS, "Internal errors reported", "fatal", "false");
        this.delegate = delegate;
    }

    @Override
    public void report(Throwable error, boolean fatal) {
        if (fatal) {
            fatalCounter.increment();
            log.error("Event dropped: {}", error.getMessage(), error);
        } else {
            recoveredCounter.increment();
            log.warn("Recovered from internal error: {}", error.getMessage());
            log.debug("Recovered error detail", error);
        }
        if (delegate != null) {
            delegate.report(error, fatal);
        }
    }
}
