package com.planwright.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "planwright.checkpoint")
public class CheckpointProperties {

    /** "file" (default) or "memory". */
    private String type = "file";

    /** Base directory of the file store. */
    private String directory = "./data/checkpoints";

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
