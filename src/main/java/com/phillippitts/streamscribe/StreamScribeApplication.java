package com.phillippitts.streamscribe;

import com.phillippitts.streamscribe.config.properties.ArchiveProperties;
import com.phillippitts.streamscribe.config.properties.BatchingProperties;
import com.phillippitts.streamscribe.config.properties.CodecProperties;
import com.phillippitts.streamscribe.config.properties.IngestProperties;
import com.phillippitts.streamscribe.config.properties.OpenAiProperties;
import com.phillippitts.streamscribe.config.properties.ThreadPoolProperties;
import com.phillippitts.streamscribe.config.properties.TranscriptionProperties;
import com.phillippitts.streamscribe.config.properties.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        IngestProperties.class,
        BatchingProperties.class,
        ThreadPoolProperties.class,
        CodecProperties.class,
        TranscriptionProperties.class,
        WhisperConfig.class,
        OpenAiProperties.class,
        ArchiveProperties.class
})
@EnableScheduling
public class StreamScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamScribeApplication.class, args);
    }

}
