package com.phillippitts.streamscribe.service.audio;

import com.phillippitts.streamscribe.exception.InvalidAudioException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

import static com.phillippitts.streamscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.streamscribe.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Encodes and decodes the canonical audio container: a minimal PCM WAV file
 * (16 kHz, 16-bit signed PCM, mono, little-endian).
 *
 * <p>{@link #wrap(byte[])} and {@link #unwrap(byte[])} are inverses: unwrapping a wrapped
 * payload returns exactly the original PCM bytes. Only the canonical format is produced or
 * accepted, to avoid ambiguity.
 */
public final class WavContainer {

    private WavContainer() {}

    /**
     * Wraps raw PCM16LE mono 16 kHz audio in a 44-byte RIFF/WAVE header.
     *
     * @param pcm canonical PCM payload (may be empty)
     * @return complete WAV container bytes
     */
    public static byte[] wrap(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            writeTo(pcm, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Writes a WAV file containing the given canonical PCM payload.
     *
     * @param pcm     raw PCM16LE mono audio at 16kHz
     * @param wavPath output file path (will be created or overwritten)
     */
    public static void write(byte[] pcm, Path wavPath) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        try (OutputStream os = Files.newOutputStream(wavPath)) {
            writeTo(pcm, os);
            os.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write WAV file to " + wavPath + ": " + e.getMessage(), e);
        }
    }

    private static void writeTo(byte[] pcm, OutputStream os) throws IOException {
        int dataSize = pcm.length;

        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, WavFormat.FMT_CHUNK_MIN_SIZE);
        writeLEShort(os, WavFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, REQUIRED_CHANNELS);
        writeLEInt(os, REQUIRED_SAMPLE_RATE);
        writeLEInt(os, REQUIRED_BYTE_RATE);
        writeLEShort(os, REQUIRED_BLOCK_ALIGN);
        writeLEShort(os, REQUIRED_BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);
        os.write(pcm);
    }

    /**
     * Checks the RIFF/WAVE magic without validating the rest of the structure.
     */
    public static boolean isWav(byte[] a) {
        return a != null && a.length >= WavFormat.RIFF_HEADER_SIZE
            && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
            && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    /**
     * Returns {@code true} if the bytes are a well-formed WAV in the canonical format.
     */
    public static boolean isCanonical(byte[] wav) {
        if (!isWav(wav)) {
            return false;
        }
        try {
            unwrap(wav);
            return true;
        } catch (InvalidAudioException e) {
            return false;
        }
    }

    /**
     * Extracts the PCM payload of a canonical WAV container.
     *
     * <p>Walks the chunk list so files with extra chunks (LIST, fact) or an extended fmt chunk
     * are accepted, as long as the fmt fields match the canonical format.
     *
     * @param wav WAV container bytes
     * @return PCM payload of the data chunk
     * @throws InvalidAudioException if the structure is malformed or the format is not canonical
     */
    public static byte[] unwrap(byte[] wav) {
        if (!isWav(wav)) {
            throw new InvalidAudioException(wav == null ? 0 : wav.length, "Missing RIFF/WAVE header");
        }

        int offset = WavFormat.RIFF_HEADER_SIZE;
        boolean fmtSeen = false;
        while (offset + WavFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String chunkId = new String(wav, offset, 4, StandardCharsets.US_ASCII);
            int chunkSize = readLEInt(wav, offset + 4);
            int body = offset + WavFormat.CHUNK_HEADER_SIZE;
            if (chunkSize < 0 || body + chunkSize > wav.length) {
                throw new InvalidAudioException(wav.length, "Invalid chunk size " + chunkSize + " at offset " + offset);
            }

            if ("fmt ".equals(chunkId)) {
                validateFmtChunk(wav, body, chunkSize);
                fmtSeen = true;
            } else if ("data".equals(chunkId)) {
                if (!fmtSeen) {
                    throw new InvalidAudioException(wav.length, "data chunk precedes fmt chunk");
                }
                if (chunkSize % REQUIRED_BLOCK_ALIGN != 0) {
                    throw new InvalidAudioException(wav.length, "data not aligned to block size " + REQUIRED_BLOCK_ALIGN);
                }
                return Arrays.copyOfRange(wav, body, body + chunkSize);
            }

            offset = body + chunkSize;
            if (chunkSize % 2 == 1) {
                offset++; // chunks are padded to even byte boundaries
            }
        }
        throw new InvalidAudioException(wav.length, "Missing data chunk");
    }

    private static void validateFmtChunk(byte[] wav, int offset, int size) {
        if (size < WavFormat.FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException(wav.length, "fmt chunk too small: " + size + " bytes");
        }
        int audioFormat = readLEShort(wav, offset);
        int channels = readLEShort(wav, offset + 2);
        int sampleRate = readLEInt(wav, offset + 4);
        int bitsPerSample = readLEShort(wav, offset + 14);

        if (audioFormat != WavFormat.AUDIO_FORMAT_PCM
                || channels != REQUIRED_CHANNELS
                || sampleRate != REQUIRED_SAMPLE_RATE
                || bitsPerSample != REQUIRED_BITS_PER_SAMPLE) {
            throw new InvalidAudioException(wav.length, String.format(
                    "Not canonical: format=%d channels=%d rate=%d bits=%d",
                    audioFormat, channels, sampleRate, bitsPerSample));
        }
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }

    private static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    private static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
                | ((a[off + 1] & 0xFF) << 8)
                | ((a[off + 2] & 0xFF) << 16)
                | ((a[off + 3] & 0xFF) << 24);
    }
}
