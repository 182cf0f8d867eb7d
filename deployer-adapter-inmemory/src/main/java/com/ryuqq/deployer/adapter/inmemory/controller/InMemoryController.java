package com.ryuqq.deployer.adapter.inmemory.controller;

import com.ryuqq.deployer.core.exception.ControllerException;
import com.ryuqq.deployer.core.exception.NotFoundException;
import com.ryuqq.deployer.core.model.Formation;
import com.ryuqq.deployer.core.model.JobEvent;
import com.ryuqq.deployer.core.model.JobState;
import com.ryuqq.deployer.core.spi.Controller;
import com.ryuqq.deployer.core.spi.JobEventStream;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link Controller} SPI with a simulated scheduler.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>formations:</strong> HashMap&lt;String, Formation&gt; - current formation by "appId/releaseId"</li>
 *   <li><strong>formationHistory:</strong> ArrayList&lt;Formation&gt; - every accepted write, in order</li>
 *   <li><strong>eventHistory:</strong> ArrayList&lt;JobEvent&gt; - every emitted job event; position = index + 1</li>
 *   <li><strong>streams:</strong> ConcurrentHashMap&lt;String, CopyOnWriteArrayList&lt;InMemoryJobEventStream&gt;&gt; - open streams per app</li>
 * </ul>
 *
 * <p><strong>Simulated Scheduler:</strong></p>
 * <p>When scheduling is enabled (the default), each {@link #putFormation} is diffed against the
 * previous formation of the same release:</p>
 * <ul>
 *   <li>Each added unit emits {@code starting} then {@code up}, or {@code starting} then
 *       {@code crashed} when {@link #crashOnStart} was registered for that release and type</li>
 *   <li>Each removed unit emits {@code down}</li>
 * </ul>
 * <p>Events are emitted synchronously into every open stream of the app before
 * {@code putFormation} returns. Disable scheduling with {@link #setScheduling} and drive
 * streams by hand through {@link #emit}.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <p>Writes, emission and stream registration share one monitor, so a stream opened with
 * {@code sinceId} sees the history replay and later events without gaps or duplicates.</p>
 *
 * @author Deployer Team
 * @since 1.0.0
 */
public class InMemoryController implements Controller {

    private final Map<String, Formation> formations;
    private final List<Formation> formationHistory;
    private final List<JobEvent> eventHistory;
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<InMemoryJobEventStream>> streams;
    private final Set<String> crashOnStart;
    private final AtomicLong jobSequence;
    private final AtomicReference<ControllerException> nextPutFailure;
    private final AtomicReference<ControllerException> nextStreamFailure;
    private volatile boolean scheduling;

    /**
     * Creates a controller with no formations and scheduling enabled.
     */
    public InMemoryController() {
        this.formations = new HashMap<>();
        this.formationHistory = new ArrayList<>();
        this.eventHistory = new ArrayList<>();
        this.streams = new ConcurrentHashMap<>();
        this.crashOnStart = ConcurrentHashMap.newKeySet();
        this.jobSequence = new AtomicLong();
        this.nextPutFailure = new AtomicReference<>();
        this.nextStreamFailure = new AtomicReference<>();
        this.scheduling = true;
    }

    @Override
    public synchronized Formation getFormation(String appId, String releaseId) {
        if (appId == null || releaseId == null) {
            throw new IllegalArgumentException("appId and releaseId cannot be null");
        }

        Formation formation = formations.get(key(appId, releaseId));
        if (formation == null) {
            throw new NotFoundException("formation", key(appId, releaseId));
        }
        return formation;
    }

    @Override
    public synchronized void putFormation(Formation formation) {
        if (formation == null) {
            throw new IllegalArgumentException("formation cannot be null");
        }

        ControllerException failure = nextPutFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }

        String key = key(formation.appId(), formation.releaseId());
        Formation previous = formations.put(key, formation);
        formationHistory.add(formation);

        if (scheduling) {
            schedule(previous == null ? Formation.empty(formation.appId(), formation.releaseId()) : previous, formation);
        }
    }

    @Override
    public synchronized JobEventStream streamJobEvents(String appId, long sinceId) {
        if (appId == null) {
            throw new IllegalArgumentException("appId cannot be null");
        }
        if (sinceId < 0) {
            throw new IllegalArgumentException("sinceId must be non-negative, but was: " + sinceId);
        }

        ControllerException failure = nextStreamFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }

        InMemoryJobEventStream stream = new InMemoryJobEventStream(appId, this::unregister);
        if (sinceId > 0) {
            for (int position = (int) Math.min(sinceId, eventHistory.size()); position < eventHistory.size(); position++) {
                JobEvent event = eventHistory.get(position);
                if (event.appId().equals(appId)) {
                    stream.deliver(event);
                }
            }
        }
        streams.computeIfAbsent(appId, k -> new CopyOnWriteArrayList<>()).add(stream);
        return stream;
    }

    /**
     * Sets a formation without emitting job events, as if the units were already running.
     *
     * @param formation formation to seed
     */
    public synchronized void seedFormation(Formation formation) {
        if (formation == null) {
            throw new IllegalArgumentException("formation cannot be null");
        }
        formations.put(key(formation.appId(), formation.releaseId()), formation);
    }

    /**
     * Emits a job event to every open stream of its app and records it in the history.
     *
     * @param event job event
     */
    public synchronized void emit(JobEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        eventHistory.add(event);
        List<InMemoryJobEventStream> open = streams.get(event.appId());
        if (open != null) {
            for (InMemoryJobEventStream stream : open) {
                stream.deliver(event);
            }
        }
    }

    /**
     * Makes every unit of the given release and type crash on start.
     *
     * @param releaseId release
     * @param processType process type
     */
    public void crashOnStart(String releaseId, String processType) {
        crashOnStart.add(releaseId + "/" + processType);
    }

    /**
     * Enables or disables the simulated scheduler.
     *
     * @param scheduling true to emit job events on formation writes
     */
    public void setScheduling(boolean scheduling) {
        this.scheduling = scheduling;
    }

    /**
     * Makes the next {@link #putFormation} throw a {@link ControllerException}.
     *
     * @param message failure message
     */
    public void failNextPut(String message) {
        nextPutFailure.set(new ControllerException(message));
    }

    /**
     * Makes the next {@link #streamJobEvents} throw a {@link ControllerException}.
     *
     * @param message failure message
     */
    public void failNextStream(String message) {
        nextStreamFailure.set(new ControllerException(message));
    }

    /**
     * Ends every open stream of an app.
     *
     * @param appId the app
     * @param cause failure cause, null for a clean close
     */
    public void disconnectStreams(String appId, Throwable cause) {
        List<InMemoryJobEventStream> open = streams.remove(appId);
        if (open == null) {
            return;
        }
        for (InMemoryJobEventStream stream : open) {
            stream.end(cause);
        }
    }

    /**
     * Returns every accepted formation write, in order. Used for test assertions.
     *
     * @return snapshot of the write history
     */
    public synchronized List<Formation> formationHistory() {
        return new ArrayList<>(formationHistory);
    }

    /**
     * Returns every emitted job event, in order. Used for test assertions.
     *
     * @return snapshot of the event history
     */
    public synchronized List<JobEvent> eventHistory() {
        return new ArrayList<>(eventHistory);
    }

    /**
     * Returns the number of open streams of an app.
     *
     * @param appId the app
     * @return open stream count
     */
    public int openStreamCount(String appId) {
        List<InMemoryJobEventStream> open = streams.get(appId);
        return open == null ? 0 : open.size();
    }

    private void schedule(Formation previous, Formation next) {
        Set<String> types = new TreeSet<>(previous.processes().keySet());
        types.addAll(next.processes().keySet());

        for (String type : types) {
            int delta = next.count(type) - previous.count(type);
            for (int i = 0; i < delta; i++) {
                String jobId = nextJobId(next, type);
                emit(new JobEvent(next.appId(), next.releaseId(), type, JobState.STARTING, jobId));
                JobState outcome = crashOnStart.contains(next.releaseId() + "/" + type) ? JobState.CRASHED : JobState.UP;
                emit(new JobEvent(next.appId(), next.releaseId(), type, outcome, jobId));
            }
            for (int i = 0; i > delta; i--) {
                emit(new JobEvent(next.appId(), next.releaseId(), type, JobState.DOWN, nextJobId(next, type)));
            }
        }
    }

    private String nextJobId(Formation formation, String type) {
        return formation.releaseId() + "-" + type + "-" + jobSequence.incrementAndGet();
    }

    private void unregister(InMemoryJobEventStream stream) {
        streams.computeIfPresent(stream.appId(), (key, open) -> {
            open.remove(stream);
            return open.isEmpty() ? null : open;
        });
    }

    private static String key(String appId, String releaseId) {
        return appId + "/" + releaseId;
    }
}
