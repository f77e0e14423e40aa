package com.ethindexer.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Database identity. Connection details live under spring.datasource.
 */
@ConfigurationProperties(prefix = "ethindexer.database")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class DatabaseProperties {

    @NotBlank(message = "ethindexer.database.name is required (set DB_NAME)")
    private String name;
}
