package com.phillippitts.streamscribe.service.transcription.openai;

import com.phillippitts.streamscribe.config.properties.OpenAiProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.domain.TranscriptionResult;
import com.phillippitts.streamscribe.exception.TranscriptionException;
import com.phillippitts.streamscribe.service.audio.WavContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiTranscriptionOracleTest {

    private static final String URL = "https://api.example.test/v1/audio/transcriptions";
    private static final byte[] WAV = WavContainer.wrap(new byte[640]);

    private MockRestServiceServer server;
    private OpenAiTranscriptionOracle oracle;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        OpenAiProperties props = new OpenAiProperties("https://api.example.test/v1", "sk-test", "whisper-1", 10);
        oracle = new OpenAiTranscriptionOracle(builder, props, new TranscriptionProperties());
    }

    @Test
    void shouldPostMultipartFormAndParseVerboseJson() {
        // Arrange
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andExpect(content().string(allOf(
                        containsString("name=\"file\"; filename=\"batch.wav\""),
                        containsString("whisper-1"),
                        containsString("name=\"language\""),
                        containsString("verbose_json"))))
                .andRespond(withSuccess("{\"text\":\" hello there \",\"language\":\"english\",\"duration\":2.0}",
                        MediaType.APPLICATION_JSON));

        // Act
        TranscriptionResult result = oracle.transcribe(WAV, "en");

        // Assert
        assertThat(result.text()).isEqualTo("hello there");
        assertThat(result.detectedLanguage()).isEqualTo("english");
        assertThat(result.engineName()).isEqualTo("openai");
        assertThat(result.confidence()).isEqualTo(0.95);
        server.verify();
    }

    @Test
    void shouldOmitLanguagePartWhenBlank() {
        server.expect(requestTo(URL))
                .andExpect(content().string(not(containsString("name=\"language\""))))
                .andRespond(withSuccess("{\"text\":\"\"}", MediaType.APPLICATION_JSON));

        TranscriptionResult result = oracle.transcribe(WAV, " ");

        assertThat(result.text()).isEmpty();
        assertThat(result.detectedLanguage()).isNull();
        server.verify();
    }

    @Test
    void shouldMapRateLimitToTranscriptionExceptionWithStatus() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":{\"message\":\"rate limited\"}}"));

        assertThatThrownBy(() -> oracle.transcribe(WAV, "en"))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("httpStatus=429")
                .hasMessageContaining("rate limited")
                .hasMessageContaining("engine: openai");
    }

    @Test
    void shouldMapConnectionFailureToTranscriptionException() {
        server.expect(requestTo(URL)).andRespond(withException(new IOException("connection refused")));

        assertThatThrownBy(() -> oracle.transcribe(WAV, "en"))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("unreachable")
                .hasMessageContaining("baseUrl=https://api.example.test/v1");
    }

    @Test
    void shouldRejectUnparseableBody() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html>oops</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> oracle.transcribe(WAV, "en"))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Unparseable response");
    }
}
