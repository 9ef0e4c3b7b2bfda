package com.phillippitts.streamscribe.service.transcription.whisper;

import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.config.properties.WhisperConfig;
import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.transcription.TranscriptionOracle;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link TranscriptionOracle} backed by the whisper.cpp command-line binary.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>Writes the batch container to a temporary WAV file</li>
 *   <li>Invokes whisper.cpp in JSON mode via {@link WhisperProcessManager}</li>
 *   <li>Parses text and detected language with {@link WhisperJsonParser}, then deletes the temp file</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> each call uses its own temp file and subprocess, so concurrent sessions
 * do not interfere.
 *
 * <p><b>Privacy:</b> never logs transcript text at INFO level, only duration and character count.
 */
public final class WhisperTranscriptionOracle implements TranscriptionOracle {

    private static final Logger LOG = LogManager.getLogger(WhisperTranscriptionOracle.class);

    private final WhisperConfig cfg;
    private final WhisperProcessManager manager;
    private final double confidence;

    public WhisperTranscriptionOracle(WhisperConfig cfg, WhisperProcessManager manager,
                                      TranscriptionProperties transcriptionProperties) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.confidence = transcriptionProperties.getDefaultConfidence();
        LOG.info("Whisper oracle configured: bin={}, model={}, timeout={}s, threads={}",
                cfg.binaryPath(), cfg.modelPath(), cfg.timeoutSeconds(), cfg.threads());
    }

    @Override
    public TranscriptionResult transcribe(byte[] wavContainer, String language) {
        if (wavContainer == null || wavContainer.length == 0) {
            throw new IllegalArgumentException("wavContainer must not be null or empty");
        }
        Path wav = null;
        long startTime = System.nanoTime();
        try {
            wav = Files.createTempFile("whisper-", ".wav");
            Files.write(wav, wavContainer);
            String json = manager.transcribe(wav, language, cfg);
            String text = WhisperJsonParser.extractText(json);
            String detected = WhisperJsonParser.extractLanguage(json);

            LOG.debug("Whisper transcribed batch in {} ms (chars={}, language={})",
                    TimeUtils.elapsedMillis(startTime), text.length(), detected);
            return TranscriptionResult.of(text, confidence, detected, WhisperConstants.ENGINE);
        } catch (IOException e) {
            throw new TranscriptionException("Failed to stage WAV for whisper: " + e.getMessage(),
                    WhisperConstants.ENGINE, e);
        } finally {
            cleanupTempFile(wav);
        }
    }

    @Override
    public String getEngineName() {
        return WhisperConstants.ENGINE;
    }

    private static void cleanupTempFile(Path wav) {
        if (wav == null) {
            return;
        }
        try {
            Files.deleteIfExists(wav);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp WAV {}: {}", wav, e.toString());
        }
    }
}
