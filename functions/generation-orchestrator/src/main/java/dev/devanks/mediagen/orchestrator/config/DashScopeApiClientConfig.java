package dev.devanks.mediagen.orchestrator.config;

import feign.Logger.Level;
import feign.Request;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

import static feign.Logger.Level.BASIC;

@RequiredArgsConstructor
public class DashScopeApiClientConfig {

    private final OrchestratorProperties properties;

    @Bean
    public Request.Options dashScopeRequestOptions() {
        long timeoutMillis = TimeUnit.SECONDS.toMillis(properties.getTimeoutSeconds());
        return new Request.Options(timeoutMillis, TimeUnit.MILLISECONDS, timeoutMillis, TimeUnit.MILLISECONDS, true);
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
