/**
 * Per-session ingestion, buffering and batching engine.
 *
 * <p>Flow for one connection:
 * <ol>
 *   <li>{@link com.phillippitts.streamscribe.service.ingest.SessionRegistry} creates a
 *       {@link com.phillippitts.streamscribe.service.ingest.SessionStateMachine}</li>
 *   <li>Inbound events reach the machine through the session's
 *       {@link com.phillippitts.streamscribe.service.ingest.SessionWorker}, strictly in order</li>
 *   <li>Chunks land in a {@link com.phillippitts.streamscribe.service.ingest.SessionAudioBuffer};
 *       {@link com.phillippitts.streamscribe.service.ingest.BatchTriggerPolicy} decides when
 *       {@link com.phillippitts.streamscribe.service.ingest.BatchProcessor} hands a batch to the
 *       transcription oracle</li>
 *   <li>On end of recording or disconnect,
 *       {@link com.phillippitts.streamscribe.service.ingest.SessionFinalizer} drains, archives and
 *       deregisters the session</li>
 * </ol>
 */
package com.phillippitts.streamscribe.service.ingest;
