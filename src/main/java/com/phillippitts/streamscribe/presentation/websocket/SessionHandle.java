package com.phillippitts.streamscribe.presentation.websocket;

import com.phillippitts.streamscribe.service.ingest.SessionWorker;

/**
 * Per-connection state kept in the WebSocket session attributes.
 *
 * @param sessionId ingestion session id bound to the connection
 * @param worker    serial context every event for the session runs on
 */
record SessionHandle(String sessionId, SessionWorker worker) {

    static final String ATTRIBUTE = "streamscribe.session";
}
