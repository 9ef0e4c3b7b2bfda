/**
 * Domain values shared by the ingestion engine and its collaborators.
 *
 * <p>All types here are immutable records or enums:
 * <ul>
 *   <li>{@link com.phillippitts.streamscribe.domain.SourceFormat} - per-session source encoding</li>
 *   <li>{@link com.phillippitts.streamscribe.domain.ChunkMeta} - metadata of a pending chunk</li>
 *   <li>{@link com.phillippitts.streamscribe.domain.TranscriptionResult} - text produced for a batch</li>
 * </ul>
 *
 * <p>The mutable per-session state lives in
 * {@link com.phillippitts.streamscribe.service.ingest.AudioSession}, not here.
 *
 * @since 1.0
 */
package com.phillippitts.streamscribe.domain;
