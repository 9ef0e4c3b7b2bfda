package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.OpenAiProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.config.properties.WhisperConfig;
import com.phillippitts.streamscribe.service.process.ExternalProcessRunner;
import com.phillippitts.streamscribe.service.transcription.TranscriptionOracle;
import com.phillippitts.streamscribe.service.transcription.openai.OpenAiTranscriptionOracle;
import com.phillippitts.streamscribe.service.transcription.whisper.WhisperProcessManager;
import com.phillippitts.streamscribe.service.transcription.whisper.WhisperTranscriptionOracle;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Selects the {@link TranscriptionOracle} from {@code transcription.provider}.
 * <ul>
 *   <li>{@code WHISPER} (default) - local whisper.cpp process per batch</li>
 *   <li>{@code OPENAI} - OpenAI-compatible HTTP transcription API</li>
 * </ul>
 */
@Configuration
public class TranscriptionConfig {

    @Bean
    public WhisperProcessManager whisperProcessManager(ExternalProcessRunner runner) {
        return new WhisperProcessManager(runner);
    }

    @Bean
    @ConditionalOnProperty(prefix = "transcription", name = "provider", havingValue = "WHISPER", matchIfMissing = true)
    public TranscriptionOracle whisperTranscriptionOracle(WhisperConfig whisperConfig,
                                                          WhisperProcessManager manager,
                                                          TranscriptionProperties transcriptionProperties) {
        return new WhisperTranscriptionOracle(whisperConfig, manager, transcriptionProperties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "transcription", name = "provider", havingValue = "OPENAI")
    public TranscriptionOracle openAiTranscriptionOracle(RestClient.Builder restClientBuilder,
                                                         OpenAiProperties openAiProperties,
                                                         TranscriptionProperties transcriptionProperties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        Duration timeout = Duration.ofSeconds(openAiProperties.timeoutSeconds());
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        return new OpenAiTranscriptionOracle(restClientBuilder.requestFactory(requestFactory),
                openAiProperties, transcriptionProperties);
    }
}
