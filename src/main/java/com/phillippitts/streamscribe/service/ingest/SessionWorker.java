package com.phillippitts.streamscribe.service.ingest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sequential processing context for one session on top of a shared pool.
 *
 * <p>Tasks run in submission order and never overlap, although consecutive tasks may run on
 * different pool threads. Different sessions' workers run in parallel. Each task runs with
 * {@code sessionId} in the Log4j2 {@link ThreadContext}.
 */
public final class SessionWorker {

    private static final Logger LOG = LogManager.getLogger(SessionWorker.class);

    static final String MDC_SESSION_ID = "sessionId";

    private final String sessionId;
    private final Executor executor;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private Runnable active;

    public SessionWorker(String sessionId, Executor executor) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public synchronized void submit(Runnable task) {
        Objects.requireNonNull(task, "task");
        tasks.add(() -> {
            try {
                runInContext(task);
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active == null) {
            return;
        }
        try {
            executor.execute(active);
        } catch (RejectedExecutionException e) {
            LOG.warn("Executor rejected work for session {}; dropping {} queued task(s)",
                    sessionId, tasks.size() + 1);
            tasks.clear();
            active = null;
        }
    }

    private void runInContext(Runnable task) {
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.error("Unhandled failure in session {} task", sessionId, e);
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    public String getSessionId() {
        return sessionId;
    }
}
