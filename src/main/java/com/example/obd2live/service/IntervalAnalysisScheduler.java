package com.example.obd2live.service;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.model.AnalysisKind;
import com.example.obd2live.model.AnalysisRecord;
import com.example.obd2live.model.AnalysisStatus;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Arms one timer per configured offset from session start. Each firing runs a
 * best-effort interval analysis over everything persisted so far; failures are
 * recorded and never retried.
 */
@Service
public class IntervalAnalysisScheduler {

    private static final Logger logger = LoggerFactory.getLogger(IntervalAnalysisScheduler.class);

    static final String NO_DATA = "no data";

    private final TaskScheduler taskScheduler;
    private final SessionRegistry registry;
    private final StoreClient store;
    private final AnalysisRunner runner;
    private final Obd2Properties properties;

    public IntervalAnalysisScheduler(@Qualifier("intervalTaskScheduler") TaskScheduler taskScheduler,
                                     SessionRegistry registry,
                                     StoreClient store,
                                     AnalysisRunner runner,
                                     Obd2Properties properties) {
        this.taskScheduler = taskScheduler;
        this.registry = registry;
        this.store = store;
        this.runner = runner;
        this.properties = properties;
    }

    /**
     * Arms the timers of a registered session. Offsets already behind the
     * current time are not armed, so re-attaching a session after a restart
     * does not replay old intervals.
     */
    public int start(String sessionId, Instant startTime) {
        Optional<SessionRuntime> runtime = registry.find(sessionId);
        if (runtime.isEmpty()) {
            logger.warn("Not arming interval analyses: session {} is not registered", sessionId);
            return 0;
        }
        Instant now = Instant.now();
        int armed = 0;
        for (Duration offset : properties.getIntervals().getOffsets()) {
            Instant fireAt = startTime.plus(offset);
            if (fireAt.isBefore(now)) {
                continue;
            }
            String label = labelFor(offset);
            ScheduledFuture<?> timer = taskScheduler.schedule(() -> fire(sessionId, label, startTime), fireAt);
            if (timer != null) {
                runtime.get().timers().add(timer);
                armed++;
            }
        }
        logger.debug("Armed {} interval analyses for session {}", armed, sessionId);
        return armed;
    }

    /**
     * Cancels every timer of the session that has not fired yet. A run already
     * in progress finishes and is recorded.
     */
    public int stop(String sessionId) {
        return registry.find(sessionId).map(runtime -> {
            List<ScheduledFuture<?>> timers = runtime.timers();
            int cancelled = 0;
            for (ScheduledFuture<?> timer : timers) {
                if (timer.cancel(false)) {
                    cancelled++;
                }
            }
            timers.clear();
            if (cancelled > 0) {
                logger.debug("Cancelled {} pending interval analyses for session {}", cancelled, sessionId);
            }
            return cancelled;
        }).orElse(0);
    }

    void fire(String sessionId, String label, Instant startTime) {
        try {
            Optional<SessionRuntime> runtime = registry.find(sessionId);
            if (runtime.isEmpty() || runtime.get().getStatus() != SessionStatus.ACTIVE) {
                logger.debug("Skipping {} interval analysis: session {} is not active", label, sessionId);
                return;
            }
            Instant now = Instant.now();
            long count = store.countDataPoints(sessionId);
            AnalysisRecord record = count == 0
                    ? runner.skip(sessionId, AnalysisKind.INTERVAL, label, startTime, now, NO_DATA)
                    : runner.run(sessionId, AnalysisKind.INTERVAL, label, startTime, now, count);
            store.updateSession(sessionId, Map.of("intervalAnalysis." + label, AnalysisRunner.summarize(record)));
        } catch (Exception e) {
            logger.error("Interval analysis {} for session {} failed", label, sessionId, e);
        }
    }

    /**
     * Completed interval results keyed by offset label, in offset order. Empty
     * when nothing has completed yet.
     */
    public Map<String, AnalysisRecord> getIntervalResults(String sessionId) {
        Map<String, AnalysisRecord> completed = new LinkedHashMap<>();
        for (AnalysisRecord record : store.findAnalyses(sessionId, AnalysisKind.INTERVAL)) {
            if (record.getStatus() == AnalysisStatus.COMPLETED) {
                completed.put(record.getLabel(), record);
            }
        }
        Map<String, AnalysisRecord> ordered = new LinkedHashMap<>();
        for (Duration offset : properties.getIntervals().getOffsets()) {
            String label = labelFor(offset);
            AnalysisRecord record = completed.remove(label);
            if (record != null) {
                ordered.put(label, record);
            }
        }
        ordered.putAll(completed);
        return ordered;
    }

    /**
     * "15s", "1m", "2m", "90s": whole minutes use minutes, anything else seconds.
     */
    static String labelFor(Duration offset) {
        long seconds = offset.getSeconds();
        if (seconds >= 60 && seconds % 60 == 0) {
            return (seconds / 60) + "m";
        }
        return seconds + "s";
    }
}
