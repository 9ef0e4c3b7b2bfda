/**
 * Spring wiring: executors, WebSocket endpoint, transcription provider selection and the
 * codec and archive collaborators. Typed settings live in {@code config.properties}.
 */
package com.phillippitts.streamscribe.config;
