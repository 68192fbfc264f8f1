package com.tradejournal.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for statement imports.
 *
 * <p>Properties are read from the {@code tradejournal.import} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.import")
@Getter
@Setter
public class ImportConfig {

    /** Owner id used when a request carries no {@code X-Owner-Id} header. */
    private String defaultOwner = "local";

    /**
     * Extra local date-time patterns tried, as UTC, when a timestamp cell is not ISO-8601.
     * Covers broker exports such as {@code 11/18/2025 18:02:12}.
     */
    private List<String> timestampPatterns = new ArrayList<>(List.of(
            "M/d/yyyy H:mm:ss", "M/d/yyyy H:mm", "M/d/yy H:mm:ss", "M/d/yy H:mm", "yyyy/M/d H:mm:ss"));
}
