package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.ArchiveProperties;
import com.phillippitts.streamscribe.config.properties.CodecProperties;
import com.phillippitts.streamscribe.service.archive.FileSystemObjectStore;
import com.phillippitts.streamscribe.service.archive.NoopObjectStore;
import com.phillippitts.streamscribe.service.archive.ObjectStore;
import com.phillippitts.streamscribe.service.codec.CodecTranscoder;
import com.phillippitts.streamscribe.service.codec.FfmpegCodecTranscoder;
import com.phillippitts.streamscribe.service.codec.PcmDecoder;
import com.phillippitts.streamscribe.service.process.ExternalProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the collaborators the ingestion pipeline depends on: clock, codec and object store.
 */
@Configuration
public class IngestConfig {

    private static final Logger LOG = LogManager.getLogger(IngestConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExternalProcessRunner externalProcessRunner() {
        return new ExternalProcessRunner();
    }

    @Bean
    public CodecTranscoder codecTranscoder(CodecProperties codecProperties, ExternalProcessRunner runner) {
        return new FfmpegCodecTranscoder(codecProperties, runner);
    }

    @Bean
    public PcmDecoder pcmDecoder(CodecTranscoder codecTranscoder) {
        return new PcmDecoder(codecTranscoder);
    }

    /**
     * Local archive when {@code archive.enabled} is true (the default), otherwise a store that
     * discards every recording.
     */
    @Bean
    public ObjectStore objectStore(ArchiveProperties archiveProperties, Clock clock) {
        if (!archiveProperties.isEnabled()) {
            LOG.info("Archival disabled; finished sessions will not be stored");
            return new NoopObjectStore();
        }
        Path root = Path.of(archiveProperties.getDirectory()).toAbsolutePath();
        LOG.info("Archiving finished sessions under {}", root);
        return new FileSystemObjectStore(root, clock);
    }
}
