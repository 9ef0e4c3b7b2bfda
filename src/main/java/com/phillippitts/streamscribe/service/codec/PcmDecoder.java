package com.phillippitts.streamscribe.service.codec;

import com.phillippitts.streamscribe.exception.DecodeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Decodes source audio with an explicit fallback step: one attempt with the container hint
 * derived from the declared mime type, then, only if that fails, one attempt with format
 * auto-detection.
 *
 * <p>Both attempts yield a {@link DecodeResult}; the transcoder's exception is caught once at
 * the attempt boundary and never used to drive the fallback.
 */
public class PcmDecoder {

    private static final Logger LOG = LogManager.getLogger(PcmDecoder.class);

    private final CodecTranscoder transcoder;

    public PcmDecoder(CodecTranscoder transcoder) {
        this.transcoder = Objects.requireNonNull(transcoder, "transcoder");
    }

    /**
     * @param source   encoded audio
     * @param mimeType declared mime type (may be null)
     * @return result of the hinted attempt, or of the auto-detect retry when the hinted one failed
     */
    public DecodeResult decode(byte[] source, String mimeType) {
        String hint = FormatHints.fromMimeType(mimeType);
        DecodeResult hinted = attempt(source, hint);
        if (hinted.isSuccess() || hint == null) {
            return hinted;
        }
        LOG.debug("Decode with hint '{}' failed, retrying with auto-detection: {}",
                hint, hinted.error().getMessage());
        return attempt(source, null);
    }

    private DecodeResult attempt(byte[] source, String hint) {
        try {
            return DecodeResult.success(transcoder.decode(source, hint));
        } catch (DecodeException e) {
            return DecodeResult.failure(e);
        }
    }
}
