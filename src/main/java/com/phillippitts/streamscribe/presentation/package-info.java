/**
 * Transport layer: the audio WebSocket endpoint and the client message protocol.
 *
 * <p>{@code protocol} turns text frames into {@link
 * com.phillippitts.streamscribe.presentation.protocol.InboundMessage}s; {@code websocket} binds
 * each connection to a session and queues its events on the session worker.
 */
package com.phillippitts.streamscribe.presentation;
