/**
 * Transcription oracles.
 *
 * <p>Exactly one {@link com.phillippitts.streamscribe.service.transcription.TranscriptionOracle}
 * bean is active, selected by {@code transcription.provider}:
 * <ul>
 *   <li>{@code WHISPER} - local whisper.cpp binary
 *       ({@link com.phillippitts.streamscribe.service.transcription.whisper.WhisperTranscriptionOracle})</li>
 *   <li>{@code OPENAI} - OpenAI-compatible HTTP API
 *       ({@link com.phillippitts.streamscribe.service.transcription.openai.OpenAiTranscriptionOracle})</li>
 * </ul>
 */
package com.phillippitts.streamscribe.service.transcription;
