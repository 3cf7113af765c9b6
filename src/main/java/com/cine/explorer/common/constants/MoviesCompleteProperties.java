package com.cine.explorer.common.constants;

import com.cine.explorer.enums.PublishMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "cine.build")
public class MoviesCompleteProperties {

    /**
     * Run one build when the application starts
     */
    private boolean runOnStartup = false;

    @Min(1)
    private int batchSize = 1000;

    /**
     * Log write progress every N batches
     */
    @Min(1)
    private int progressEveryBatches = 5;

    @NotNull
    private PublishMode publishMode = PublishMode.DROP_AND_REPLACE;

    /**
     * The summary example is the first document with more votes than this
     */
    @Min(0)
    private long exampleMinVotes = 1_000_000L;
}
