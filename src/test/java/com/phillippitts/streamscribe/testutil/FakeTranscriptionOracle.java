package com.phillippitts.streamscribe.testutil;

import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.transcription.TranscriptionOracle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Oracle that answers "batch N" and records every container it receives.
 */
public class FakeTranscriptionOracle implements TranscriptionOracle {

    public static final String ENGINE = "fake";

    /** One call to the oracle. */
    public record Call(byte[] wav, String language) {}

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();

    /** The next {@code n} calls throw {@link TranscriptionException}. */
    public FakeTranscriptionOracle failNext(int n) {
        failuresLeft.set(n);
        return this;
    }

    @Override
    public TranscriptionResult transcribe(byte[] wavContainer, String language) {
        calls.add(new Call(wavContainer, language));
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TranscriptionException("scripted oracle failure", ENGINE);
        }
        return TranscriptionResult.of("batch " + calls.size(), 0.95, language, ENGINE);
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    public List<Call> calls() {
        return calls;
    }

    public int callCount() {
        return calls.size();
    }
}
