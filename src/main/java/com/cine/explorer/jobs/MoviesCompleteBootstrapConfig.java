package com.cine.explorer.jobs;

import com.cine.explorer.service.build.MoviesCompleteBuildService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Start-up rebuild of movies_complete.
 * <p>
 * Toggle with:
 * cine.build.run-on-startup=true
 * <p>
 * A failed build fails the start-up, with the phase and cause in the log.
 */
@Configuration
@ConditionalOnProperty(prefix = "cine.build", name = "run-on-startup", havingValue = "true")
public class MoviesCompleteBootstrapConfig {

    private static final Logger log = LoggerFactory.getLogger(MoviesCompleteBootstrapConfig.class);

    @Bean
    public ApplicationRunner moviesCompleteBootstrap(MoviesCompleteBuildService buildService) {
        return args -> {
            log.info("Start-up movies_complete build requested (cine.build.run-on-startup=true)");
            buildService.build();
        };
    }
}
