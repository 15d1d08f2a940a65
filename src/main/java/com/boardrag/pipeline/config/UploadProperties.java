package com.boardrag.pipeline.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Upload intake settings. {@code allowedTypes} maps a lowercase extension without the dot to the
 * largest accepted file of that type.
 */
@Validated
@ConfigurationProperties(prefix = "app.upload")
public record UploadProperties(
    @NotBlank String stagingDir,
    @NotEmpty Map<String, DataSize> allowedTypes
) {

    public Optional<DataSize> maxSizeFor(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(allowedTypes.get(extension.toLowerCase(Locale.ROOT)));
    }
}
