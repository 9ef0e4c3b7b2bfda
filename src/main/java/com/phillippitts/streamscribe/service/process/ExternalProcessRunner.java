package com.phillippitts.streamscribe.service.process;

import com.phillippitts.streamscribe.util.ProcessTimeouts;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command to completion with a timeout, capturing stdout and stderr.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Drain stdout and stderr concurrently so a chatty process never blocks on a full pipe</li>
 *   <li>Cap captured output; excess is drained and discarded</li>
 *   <li>Terminate runaway processes (graceful, then forcible)</li>
 * </ul>
 *
 * <p>The runner keeps no per-call state in fields, so one instance is shared by every session.
 * Callers map a failed {@link ProcessOutput} to their own exception type.
 */
public final class ExternalProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ExternalProcessRunner.class);

    /** stderr is only kept for diagnostics. */
    public static final int STDERR_MAX_BYTES = 64 * 1024;

    private final ProcessFactory processFactory;

    public ExternalProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ExternalProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs {@code command} and waits for it.
     *
     * @param command        executable followed by its arguments
     * @param workingDir     working directory (may be null)
     * @param timeout        maximum run time
     * @param maxStdoutBytes cap on captured stdout
     * @return captured output; check {@link ProcessOutput#succeeded()}
     * @throws IOException if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ProcessOutput run(List<String> command, Path workingDir, Duration timeout, int maxStdoutBytes) throws IOException, InterruptedException {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        String name = Path.of(command.get(0)).getFileName().toString();
        long startTime = System.nanoTime();

        Process process = processFactory.start(command, workingDir);
        BoundedSink out = new BoundedSink(maxStdoutBytes);
        BoundedSink err = new BoundedSink(STDERR_MAX_BYTES);
        Thread outGobbler = startGobbler(process.getInputStream(), out, name + "-out");
        Thread errGobbler = startGobbler(process.getErrorStream(), err, name + "-err");

        try {
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                long durationMs = TimeUtils.elapsedMillis(startTime);
                LOG.warn("Process '{}' timed out after {} ms", name, durationMs);
                return new ProcessOutput(-1, out.toByteArray(), err.asText(), durationMs, true, out.isCapReached());
            }

            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            long durationMs = TimeUtils.elapsedMillis(startTime);
            int exitCode = process.exitValue();
            LOG.debug("Process '{}' exited with {} in {} ms (stdout={}B)", name, exitCode, durationMs, out.size());
            return new ProcessOutput(exitCode, out.toByteArray(), err.asText(), durationMs, false, out.isCapReached());
        } finally {
            if (process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }

    private Thread startGobbler(InputStream inputStream, BoundedSink sink, String name) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Byte buffer that stops accumulating at a fixed capacity.
     */
    private static final class BoundedSink {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final int maxBytes;
        private boolean capReached;

        BoundedSink(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        /** Returns {@code true} only for the call that first hits the cap. */
        synchronized boolean append(byte[] chunk, int len) {
            int toWrite = Math.max(0, Math.min(len, maxBytes - buffer.size()));
            buffer.write(chunk, 0, toWrite);
            if (toWrite < len && !capReached) {
                capReached = true;
                return true;
            }
            return false;
        }

        synchronized boolean isCapReached() {
            return capReached;
        }

        synchronized int size() {
            return buffer.size();
        }

        synchronized byte[] toByteArray() {
            return buffer.toByteArray();
        }

        synchronized String asText() {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }

    /**
     * Drains one process stream into a {@link BoundedSink}. Once the sink is full the stream is
     * still read to the end so the process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final BoundedSink sink;
        private final String name;

        StreamGobbler(InputStream inputStream, BoundedSink sink, String name) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream in = inputStream) {
                int read;
                while ((read = in.read(chunk)) != -1) {
                    if (sink.append(chunk, read)) {
                        LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, sink.maxBytes);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
    }
}
