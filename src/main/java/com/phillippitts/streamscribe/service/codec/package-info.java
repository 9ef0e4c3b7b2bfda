/**
 * Source audio to canonical PCM conversion.
 *
 * <p>{@link com.phillippitts.streamscribe.service.codec.CodecTranscoder} is the collaborator
 * seam; {@link com.phillippitts.streamscribe.service.codec.PcmDecoder} adds the hinted attempt
 * followed by one auto-detect retry, returning
 * {@link com.phillippitts.streamscribe.service.codec.DecodeResult} values.
 */
package com.phillippitts.streamscribe.service.codec;
