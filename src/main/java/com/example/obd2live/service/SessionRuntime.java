package com.example.obd2live.service;

import com.example.obd2live.model.SessionStatus;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process state of one hosted session: buffer, interval timers, live feed.
 * Lives in the {@link SessionRegistry} from start until the session is ended
 * or torn down.
 */
public class SessionRuntime {

    private final String sessionId;
    private final Instant startTime;
    private volatile SessionStatus status;

    private final SessionBuffer buffer = new SessionBuffer();
    private final List<ScheduledFuture<?>> timers = new CopyOnWriteArrayList<>();
    private final LiveFeed feed;

    // held while a point is buffered and published
    private final Object ingestLock = new Object();
    private final AtomicBoolean ending = new AtomicBoolean(false);

    SessionRuntime(String sessionId, Instant startTime, SessionStatus status, int subscriberBufferSize) {
        this.sessionId = sessionId;
        this.startTime = startTime;
        this.status = status;
        this.feed = new LiveFeed(sessionId, subscriberBufferSize);
    }

    public String getSessionId() { return sessionId; }
    public Instant getStartTime() { return startTime; }
    public SessionStatus getStatus() { return status; }
    public LiveFeed getFeed() { return feed; }

    void setStatus(SessionStatus status) { this.status = status; }

    SessionBuffer buffer() { return buffer; }

    List<ScheduledFuture<?>> timers() { return timers; }

    Object ingestLock() { return ingestLock; }

    /**
     * Claims the right to tear this session down. Only the first caller wins.
     */
    boolean beginEnding() {
        return ending.compareAndSet(false, true);
    }

    public boolean isEnding() {
        return ending.get();
    }

    public boolean isAccepting() {
        return status == SessionStatus.ACTIVE && !ending.get();
    }
}
