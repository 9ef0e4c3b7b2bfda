/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.streamscribe.exception.StreamScribeException}:
 * <ul>
 *   <li>{@link com.phillippitts.streamscribe.exception.DecodeException} - source audio could not
 *       be transcoded to canonical PCM (per chunk or per batch, recoverable)</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.TranscriptionException} - the transcription
 *       oracle failed; the batch is kept and retried on the next trigger</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.ArchivalException} - the object store could
 *       not persist a finished session; logged only</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.ProtocolException} - malformed inbound
 *       message; reported to the client as an {@code error} event</li>
 *   <li>{@link com.phillippitts.streamscribe.exception.InvalidAudioException} - bytes are not a
 *       well-formed canonical WAV container</li>
 * </ul>
 *
 * <p>None of these tear down a session. Only an explicit {@code end_recording} or a
 * disconnection ends one.
 *
 * @since 1.0
 */
package com.phillippitts.streamscribe.exception;
