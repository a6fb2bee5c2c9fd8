package com.al.hl7siu.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for batch conversion of multi-message HL7 input.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.batch")
public class BatchProperties {

    /**
     * Worker threads used to convert the messages of one batch.
     * 0 = max(4, available processors)
     */
    @Min(0)
    private int threadPoolSize = 0;

    /**
     * Maximum length of the input excerpt attached to a batch error.
     */
    @Min(1)
    private int errorInputMaxLength = 200;

    public int resolveThreadPoolSize() {
        return threadPoolSize > 0 ? threadPoolSize : Math.max(4, Runtime.getRuntime().availableProcessors());
    }
}
