package io.parareq.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.parareq.metrics.Metrics;
import io.parareq.source.RetryQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs run progress; scheduled on the loop executor so it reads counters from the owning thread. */
class ProgressReporter implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

    private final StatusTracker status;
    private final RetryQueue retryQueue;
    private final Meter admitted;
    private final Timer callTime;

    ProgressReporter(StatusTracker status, RetryQueue retryQueue, Metrics metrics) {
        this.status = status;
        this.retryQueue = retryQueue;
        this.admitted = metrics.meter(Metrics.ADMITTED);
        this.callTime = metrics.timer(Metrics.CALL_TIME);
    }

    @Override
    public void run() {
        log.info("progress: started={} inProgress={} succeeded={} failed={} | rateLimitErrors={} apiErrors={} otherErrors={} | retryDepth={} admitted1m={}/s call.p50(ms)={}",
                status.started(), status.inProgress(), status.succeeded(), status.failed(),
                status.rateLimitErrors(), status.apiErrors(), status.otherErrors(),
                retryQueue.size(), fmt(admitted.getOneMinuteRate()), fmt(callTime.getSnapshot().getMedian() / 1_000_000.0));
    }

    private static String fmt(double v) { return String.format("%.3f", v); }
}
