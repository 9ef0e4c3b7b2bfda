package com.phillippitts.streamscribe.service.ingest;

import com.phillippitts.streamscribe.config.properties.IngestProperties;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;
import com.phillippitts.streamscribe.service.metrics.IngestMetrics;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds state machines wired to the application's shared collaborators.
 */
@Component
public class DefaultSessionStateMachineFactory implements SessionStateMachineFactory {

    private final SessionStateMachine.Dependencies deps;
    private final String defaultLanguage;

    public DefaultSessionStateMachineFactory(PcmDecoder decoder,
                                             BatchTriggerPolicy triggerPolicy,
                                             BatchProcessor batchProcessor,
                                             SessionFinalizer finalizer,
                                             IngestMetrics metrics,
                                             ApplicationEventPublisher publisher,
                                             Clock clock,
                                             IngestProperties ingestProperties) {
        this.deps = new SessionStateMachine.Dependencies(decoder, triggerPolicy, batchProcessor, finalizer,
                metrics, publisher, clock);
        this.defaultLanguage = ingestProperties.getDefaultLanguage();
    }

    @Override
    public SessionStateMachine create(String sessionId, SessionOutbound outbound, Runnable onClosed) {
        AudioSession session = new AudioSession(sessionId, deps.clock().instant(), defaultLanguage);
        return new SessionStateMachine(session, outbound, deps, onClosed);
    }
}
