package com.phillippitts.streamscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where finished sessions are archived.
 *
 * <p>With {@code archive.enabled=false} the object store reports every session as skipped.
 */
@ConfigurationProperties(prefix = "archive")
@Validated
public class ArchiveProperties {

    private boolean enabled = true;

    @NotBlank(message = "Archive directory must not be blank")
    private String directory = "archive";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
