package com.phillippitts.streamscribe.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceFormatTest {

    @Test
    void webmIsStreamingRegardlessOfCaseAndCodecs() {
        assertThat(SourceFormat.fromMimeType("audio/webm")).isEqualTo(SourceFormat.STREAMING_CONTAINER);
        assertThat(SourceFormat.fromMimeType("audio/WebM;codecs=opus")).isEqualTo(SourceFormat.STREAMING_CONTAINER);
    }

    @Test
    void everythingElseIsSelfDelimited() {
        assertThat(SourceFormat.fromMimeType("audio/wav")).isEqualTo(SourceFormat.RAW_PCM_CONTAINER);
        assertThat(SourceFormat.fromMimeType("audio/ogg;codecs=opus")).isEqualTo(SourceFormat.RAW_PCM_CONTAINER);
        assertThat(SourceFormat.fromMimeType(null)).isEqualTo(SourceFormat.RAW_PCM_CONTAINER);
    }
}
