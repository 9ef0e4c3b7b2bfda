/**
 * Local whisper.cpp transcription.
 *
 * <p>{@link com.phillippitts.streamscribe.service.transcription.whisper.WhisperTranscriptionOracle}
 * stages each batch as a temp WAV,
 * {@link com.phillippitts.streamscribe.service.transcription.whisper.WhisperProcessManager} runs the
 * binary in JSON mode, and {@code WhisperJsonParser} reads the result.
 */
package com.phillippitts.streamscribe.service.transcription.whisper;
