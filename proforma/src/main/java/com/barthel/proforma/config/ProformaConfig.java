package com.barthel.proforma.config;

import com.barthel.proforma.domain.finance.IrrSolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
@EnableConfigurationProperties(ProformaProperties.class)
public class ProformaConfig {

    @Bean
    public IrrSolver irrSolver(ProformaProperties properties) {
        ProformaProperties.Irr irr = properties.irr();
        return new IrrSolver(irr.lowerBound(), irr.upperBound(), irr.tolerance(),
                irr.maxIterations(), irr.initialGuess());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService scenarioExecutor(ProformaProperties properties) {
        int parallelism = properties.scenarios().parallelism();
        log.info("Scenario executor running {} threads", parallelism);
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scenario-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(parallelism, threadFactory);
    }
}
