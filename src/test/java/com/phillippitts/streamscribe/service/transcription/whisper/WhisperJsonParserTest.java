package com.phillippitts.streamscribe.service.transcription.whisper;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WhisperJsonParserTest {

    @Test
    void extractTextJoinsWhisperCppTranscriptionSegments() {
        String json = """
            {
              "result": {"language": "en"},
              "transcription": [
                {"text": " Hello"},
                {"text": " world."}
              ]
            }
            """;

        assertThat(WhisperJsonParser.extractText(json)).isEqualTo("Hello world.");
        assertThat(WhisperJsonParser.extractLanguage(json)).isEqualTo("en");
    }

    @Test
    void extractTextPrefersTopLevelText() {
        String json = "{\"text\": \" hola \", \"segments\": [{\"text\": \"ignored\"}]}";

        assertThat(WhisperJsonParser.extractText(json)).isEqualTo("hola");
    }

    @Test
    void extractTextSkipsBlankSegments() {
        String json = """
            {
              "segments": [
                {"text": "First segment"},
                {"text": ""},
                {"text": "   "},
                "not an object",
                {"text": "Last segment"}
              ]
            }
            """;

        assertThat(WhisperJsonParser.extractText(json)).isEqualTo("First segment Last segment");
    }

    @Test
    void extractTextHandlesMalformedGracefully() {
        assertThat(WhisperJsonParser.extractText("{ not-json")).isEmpty();
        assertThat(WhisperJsonParser.extractText(null)).isEmpty();
        assertThat(WhisperJsonParser.extractText("")).isEmpty();
        assertThat(WhisperJsonParser.extractText("{}")).isEmpty();
    }

    @Test
    void extractLanguageFallsBackToTopLevelField() {
        assertThat(WhisperJsonParser.extractLanguage("{\"language\": \"de\", \"text\": \"hallo\"}")).isEqualTo("de");
    }

    @Test
    void extractLanguageIsNullWhenNotReported() {
        assertThat(WhisperJsonParser.extractLanguage("{\"text\": \"hi\"}")).isNull();
        assertThat(WhisperJsonParser.extractLanguage("{\"result\": {\"language\": \"\"}}")).isNull();
        assertThat(WhisperJsonParser.extractLanguage("garbage")).isNull();
    }
}
