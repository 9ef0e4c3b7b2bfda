package com.phillippitts.streamscribe.service.transcription.openai;

import com.phillippitts.streamscribe.config.properties.OpenAiProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.streamscribe.service.transcription.TranscriptionOracle;
import com.phillippitts.streamscribe.util.LogSanitizer;
import com.phillippitts.streamscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * {@link TranscriptionOracle} that posts each batch to an OpenAI-compatible
 * {@code /audio/transcriptions} endpoint.
 *
 * <p>Request: multipart form with {@code file} (the WAV container), {@code model},
 * {@code language} and {@code response_format=verbose_json}. The verbose response carries the
 * detected language next to the text.
 *
 * <p>HTTP failures map to {@link TranscriptionException} carrying the status code; the caller
 * keeps the batch and retries on the next trigger.
 */
public final class OpenAiTranscriptionOracle implements TranscriptionOracle {

    private static final Logger LOG = LogManager.getLogger(OpenAiTranscriptionOracle.class);

    static final String ENGINE = "openai";
    static final String TRANSCRIPTIONS_PATH = "/audio/transcriptions";
    private static final int ERROR_BODY_MAX_CHARS = 512;

    private final RestClient restClient;
    private final OpenAiProperties props;
    private final double confidence;

    /**
     * @param restClientBuilder builder with the request factory (timeouts) already applied
     */
    public OpenAiTranscriptionOracle(RestClient.Builder restClientBuilder, OpenAiProperties props,
                                     TranscriptionProperties transcriptionProperties) {
        this.props = Objects.requireNonNull(props, "props");
        this.confidence = transcriptionProperties.getDefaultConfidence();
        RestClient.Builder builder = restClientBuilder.baseUrl(props.baseUrl());
        if (props.hasApiKey()) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey());
        } else {
            LOG.warn("No transcription.openai.api-key configured; requests to {} are unauthenticated",
                    props.baseUrl());
        }
        this.restClient = builder.build();
    }

    @Override
    public TranscriptionResult transcribe(byte[] wavContainer, String language) {
        if (wavContainer == null || wavContainer.length == 0) {
            throw new IllegalArgumentException("wavContainer must not be null or empty");
        }
        long startTime = System.nanoTime();
        try {
            String body = restClient.post()
                    .uri(TRANSCRIPTIONS_PATH)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(buildForm(wavContainer, language))
                    .retrieve()
                    .body(String.class);
            TranscriptionResult result = parse(body, startTime);
            LOG.debug("OpenAI transcribed batch in {} ms (chars={}, language={})",
                    TimeUtils.elapsedMillis(startTime), result.text().length(), result.detectedLanguage());
            return result;
        } catch (RestClientResponseException e) {
            throw TranscriptionExceptionBuilder.create("Transcription API rejected batch")
                    .engine(ENGINE)
                    .httpStatus(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("body", LogSanitizer.truncate(e.getResponseBodyAsString(), ERROR_BODY_MAX_CHARS))
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw TranscriptionExceptionBuilder.create("Transcription API unreachable: " + e.getMessage())
                    .engine(ENGINE)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("baseUrl", props.baseUrl())
                    .cause(e)
                    .build();
        }
    }

    private MultiValueMap<String, Object> buildForm(byte[] wavContainer, String language) {
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("file", new ByteArrayResource(wavContainer) {
            @Override
            public String getFilename() {
                return "batch.wav";
            }
        });
        form.add("model", props.model());
        if (language != null && !language.isBlank()) {
            form.add("language", language);
        }
        form.add("response_format", "verbose_json");
        return form;
    }

    private TranscriptionResult parse(String body, long startTime) {
        if (body == null || body.isBlank()) {
            throw TranscriptionExceptionBuilder.create("Empty response from transcription API")
                    .engine(ENGINE)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .build();
        }
        try {
            JSONObject json = new JSONObject(body);
            String text = json.optString("text", "").trim();
            String detected = json.optString("language", "");
            return TranscriptionResult.of(text, confidence, detected.isBlank() ? null : detected, ENGINE);
        } catch (JSONException e) {
            throw TranscriptionExceptionBuilder.create("Unparseable response from transcription API")
                    .engine(ENGINE)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("body", LogSanitizer.truncate(body, ERROR_BODY_MAX_CHARS))
                    .cause(e)
                    .build();
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }
}
