package org.carball.litepilot.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import org.carball.litepilot.model.optimization.AutoVacuumMode;
import org.carball.litepilot.model.optimization.JournalMode;
import org.carball.litepilot.model.optimization.SynchronousMode;
import org.carball.litepilot.model.optimization.TempStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contents of a YAML settings file. Every value is optional; absent values leave the profile or
 * built-in default in place.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LitePilotSettings {

    private static final ObjectMapper YAML = JsonMapper.builder(new YAMLFactory())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    @JsonProperty("database_path")
    private String databasePath;

    @JsonProperty("pool_size")
    private Integer poolSize;

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("optimization")
    private Optimization optimization;

    @JsonProperty("index_analysis")
    private IndexAnalysis indexAnalysis;

    public static LitePilotSettings load(Path file) throws IOException {
        return YAML.readValue(file.toFile(), LitePilotSettings.class);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Optimization {
        @JsonProperty("enable_auto_pragma")
        private Boolean enableAutoPragma;

        @JsonProperty("enable_auto_indexing")
        private Boolean enableAutoIndexing;

        @JsonProperty("enable_performance_tuning")
        private Boolean enablePerformanceTuning;

        @JsonProperty("enable_backup_recommendations")
        private Boolean enableBackupRecommendations;

        @JsonProperty("slow_query_threshold")
        private Double slowQueryThreshold;

        @JsonProperty("auto_vacuum_mode")
        private AutoVacuumMode autoVacuumMode;

        @JsonProperty("journal_mode")
        private JournalMode journalMode;

        @JsonProperty("synchronous")
        private SynchronousMode synchronous;

        @JsonProperty("cache_size")
        private Long cacheSize;

        @JsonProperty("temp_store")
        private TempStore tempStore;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexAnalysis {
        @JsonProperty("min_frequency")
        private Integer minFrequency;

        @JsonProperty("slow_query_threshold")
        private Double slowQueryThreshold;

        @JsonProperty("include_partial_indexes")
        private Boolean includePartialIndexes;

        @JsonProperty("max_recommendations")
        private Integer maxRecommendations;
    }
}
