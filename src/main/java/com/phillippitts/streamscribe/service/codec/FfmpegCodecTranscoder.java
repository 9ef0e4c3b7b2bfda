package com.phillippitts.streamscribe.service.codec;

import com.phillippitts.streamscribe.config.properties.CodecProperties;
import com.phillippitts.streamscribe.exception.DecodeException;
import com.phillippitts.streamscribe.service.audio.AudioFormat;
import com.phillippitts.streamscribe.service.audio.WavContainer;
import com.phillippitts.streamscribe.service.process.ExternalProcessRunner;
import com.phillippitts.streamscribe.service.process.ProcessOutput;
import com.phillippitts.streamscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@link CodecTranscoder} that shells out to ffmpeg.
 *
 * <p>CLI contract:
 * <pre>
 * ffmpeg -hide_banner -loglevel error [-f ${hint}] -i ${tmp} -f s16le -acodec pcm_s16le -ar 16000 -ac 1 pipe:1
 * </pre>
 *
 * <p>The source is written to a temp file rather than piped, because container demuxers
 * (mp4 in particular) need to seek. Input that is already a canonical WAV is unwrapped
 * in-process without starting ffmpeg.
 */
public final class FfmpegCodecTranscoder implements CodecTranscoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegCodecTranscoder.class);

    static final int PREVIEW_BYTES = 16;
    private static final int STDERR_SNIPPET_MAX_CHARS = 512;

    private final CodecProperties props;
    private final ExternalProcessRunner runner;

    public FfmpegCodecTranscoder(CodecProperties props, ExternalProcessRunner runner) {
        this.props = Objects.requireNonNull(props, "props");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public byte[] decode(byte[] source, String formatHint) {
        if (source == null || source.length == 0) {
            throw new DecodeException("Empty audio input", formatHint, "");
        }
        if (WavContainer.isCanonical(source)) {
            return WavContainer.unwrap(source);
        }

        Path input = null;
        try {
            input = Files.createTempFile("ingest-", ".bin");
            Files.write(input, source);

            ProcessOutput out = runner.run(buildCommand(formatHint, input), null,
                    Duration.ofSeconds(props.timeoutSeconds()), props.maxOutputBytes());
            if (out.timedOut()) {
                throw new DecodeException("ffmpeg timed out after " + props.timeoutSeconds() + "s",
                        formatHint, preview(source));
            }
            if (out.exitCode() != 0) {
                throw new DecodeException("ffmpeg exited with " + out.exitCode() + ": "
                        + LogSanitizer.truncate(out.stderr().trim(), STDERR_SNIPPET_MAX_CHARS),
                        formatHint, preview(source));
            }
            if (out.stdoutTruncated()) {
                throw new DecodeException("ffmpeg output exceeded " + props.maxOutputBytes()
                        + " bytes (codec.ffmpeg.max-output-bytes)", formatHint, preview(source));
            }
            byte[] pcm = alignToBlock(out.stdout());
            LOG.debug("ffmpeg decoded {}B -> {}B PCM in {} ms (hint={})",
                    source.length, pcm.length, out.durationMs(), formatHint);
            return pcm;
        } catch (IOException e) {
            throw new DecodeException("ffmpeg I/O failure: " + e.getMessage(), formatHint, preview(source), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecodeException("Interrupted while decoding", formatHint, preview(source), e);
        } finally {
            cleanupTempFile(input);
        }
    }

    List<String> buildCommand(String formatHint, Path input) {
        List<String> cmd = new ArrayList<>();
        cmd.add(props.binaryPath());
        cmd.add("-hide_banner");
        cmd.add("-loglevel");
        cmd.add("error");
        if (formatHint != null) {
            cmd.add("-f");
            cmd.add(formatHint);
        }
        cmd.add("-i");
        cmd.add(input.toAbsolutePath().toString());
        cmd.add("-f");
        cmd.add(AudioFormat.FFMPEG_PCM_FORMAT);
        cmd.add("-acodec");
        cmd.add(AudioFormat.FFMPEG_PCM_CODEC);
        cmd.add("-ar");
        cmd.add(String.valueOf(AudioFormat.REQUIRED_SAMPLE_RATE));
        cmd.add("-ac");
        cmd.add(String.valueOf(AudioFormat.REQUIRED_CHANNELS));
        cmd.add("pipe:1");
        return cmd;
    }

    /** A stream cut off by ffmpeg can end mid-sample; drop the dangling byte. */
    private static byte[] alignToBlock(byte[] pcm) {
        int remainder = pcm.length % AudioFormat.REQUIRED_BLOCK_ALIGN;
        return remainder == 0 ? pcm : Arrays.copyOf(pcm, pcm.length - remainder);
    }

    private static String preview(byte[] source) {
        return LogSanitizer.hexPreview(source, PREVIEW_BYTES);
    }

    private static void cleanupTempFile(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", path, e.toString());
        }
    }
}
