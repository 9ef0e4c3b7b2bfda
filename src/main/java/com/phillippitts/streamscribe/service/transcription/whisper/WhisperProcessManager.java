package com.phillippitts.streamscribe.service.transcription.whisper;

import com.phillippitts.streamscribe.config.properties.WhisperConfig;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.streamscribe.service.process.ExternalProcessRunner;
import com.phillippitts.streamscribe.service.process.ProcessOutput;
import com.phillippitts.streamscribe.util.LogSanitizer;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs whisper.cpp on one WAV file and returns its JSON output.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Build a deterministic CLI from {@link WhisperConfig} and the session language</li>
 *   <li>Run it through {@link ExternalProcessRunner} with the configured timeout</li>
 *   <li>Read the JSON file whisper.cpp writes next to the input</li>
 *   <li>Report failures as {@link TranscriptionException} with exit code, duration and a stderr snippet</li>
 * </ul>
 *
 * <p>Temp-file WAV handling is performed by the caller.
 */
public class WhisperProcessManager {

    private static final Logger LOG = LogManager.getLogger(WhisperProcessManager.class);

    private final ExternalProcessRunner runner;

    public WhisperProcessManager(ExternalProcessRunner runner) {
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Transcribes {@code wavPath}.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} -m ${model} -f ${wav} -l ${language} -t ${threads} -np -oj -of ${wav-without-ext}
     * </pre>
     *
     * @param wavPath  canonical WAV file (created by caller)
     * @param language language code, or "auto"
     * @param cfg      whisper configuration
     * @return JSON written by whisper.cpp (may describe an empty transcription)
     * @throws TranscriptionException on timeout, non-zero exit, or I/O error
     */
    public String transcribe(Path wavPath, String language, WhisperConfig cfg) {
        Objects.requireNonNull(wavPath, "wavPath");
        Objects.requireNonNull(cfg, "cfg");

        Path outputBase = outputBase(wavPath);
        Path jsonPath = outputBase.resolveSibling(outputBase.getFileName() + WhisperConstants.JSON_SUFFIX);
        List<String> command = buildCommand(cfg, wavPath, language, outputBase);
        long startTime = System.nanoTime();

        try {
            ProcessOutput out = runner.run(command, wavPath.getParent(),
                    Duration.ofSeconds(cfg.timeoutSeconds()), cfg.maxStdoutBytes());
            if (out.timedOut()) {
                throw whisperError("Timeout after " + cfg.timeoutSeconds() + "s", cfg, -1, out.stderr(),
                        startTime, null);
            }
            if (out.exitCode() != 0) {
                throw whisperError("Non-zero exit: " + out.exitCode(), cfg, out.exitCode(), out.stderr(),
                        startTime, null);
            }
            if (!Files.exists(jsonPath)) {
                throw whisperError("No JSON output produced", cfg, 0, out.stderr(), startTime, null);
            }
            String json = Files.readString(jsonPath, StandardCharsets.UTF_8);
            LOG.debug("Whisper JSON size={} chars", json.length());
            return json;
        } catch (IOException e) {
            throw whisperError("I/O failure: " + e.getMessage(), cfg, -1, null, startTime, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw whisperError("Interrupted", cfg, -1, null, startTime, e);
        } finally {
            deleteQuietly(jsonPath);
        }
    }

    List<String> buildCommand(WhisperConfig cfg, Path wavPath, String language, Path outputBase) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(language == null || language.isBlank() ? "auto" : language);
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        cmd.add("-np");
        cmd.add("-oj");
        cmd.add("-of");
        cmd.add(outputBase.toAbsolutePath().toString());
        return cmd;
    }

    private static Path outputBase(Path wavPath) {
        String name = wavPath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return wavPath.resolveSibling(dot > 0 ? name.substring(0, dot) : name);
    }

    /**
     * Resolves a configured path to absolute so the command does not depend on the working directory.
     */
    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute() || path.getParent() == null) {
            // bare names are looked up on PATH
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private static TranscriptionException whisperError(String msg, WhisperConfig cfg, int exitCode,
                                                       String stderr, long startNano, Throwable cause) {
        TranscriptionExceptionBuilder builder = TranscriptionExceptionBuilder.create(msg)
                .engine(WhisperConstants.ENGINE)
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(startNano))
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("modelPath", cfg.modelPath())
                .metadata("stderr", LogSanitizer.truncate(stderr, WhisperConstants.ERROR_SNIPPET_MAX_CHARS));
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete {}: {}", path, e.toString());
        }
    }
}
