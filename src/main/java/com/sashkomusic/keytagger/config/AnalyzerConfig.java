package com.sashkomusic.keytagger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerConfig {

    private String folder;
    private boolean runOnStartup = true;
    private int workers = 1;
    private Rename rename = new Rename();
    private Report report = new Report();
    private Features features = new Features();

    @Data
    public static class Rename {
        private boolean enabled = true;
        private String notation = "classic";
        private String remove = "";
        // "_:-, feat.:ft."
        private String replace = "";
    }

    @Data
    public static class Report {
        private String format = "csv";
    }

    @Data
    public static class Features {
        // empty: next to each audio file
        private String directory;
        private String suffix = ".analysis.json";
    }
}
