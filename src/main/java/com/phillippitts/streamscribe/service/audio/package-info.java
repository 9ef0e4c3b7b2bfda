/**
 * Canonical audio format and its WAV container.
 *
 * <p>Every batch handed to a {@link com.phillippitts.streamscribe.service.transcription.TranscriptionOracle}
 * and every archived session recording is 16 kHz, 16-bit signed little-endian mono PCM wrapped
 * by {@link com.phillippitts.streamscribe.service.audio.WavContainer}.
 *
 * @see com.phillippitts.streamscribe.service.audio.AudioFormat
 * @since 1.0
 */
package com.phillippitts.streamscribe.service.audio;
