package dev.devanks.mediagen.orchestrator.config;

import feign.Logger.Level;
import feign.Request;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.TimeUnit;

import static feign.Logger.Level.BASIC;

/**
 * Timeouts and logging of the Haiyi client. Cookie and platform headers travel as per-call header maps
 * built from the settings snapshot of the invocation.
 */
@RequiredArgsConstructor
public class HaiyiApiClientConfig {

    private final OrchestratorProperties properties;

    @Bean
    public Request.Options haiyiRequestOptions() {
        long timeoutMillis = TimeUnit.SECONDS.toMillis(properties.getTimeoutSeconds());
        return new Request.Options(timeoutMillis, TimeUnit.MILLISECONDS, timeoutMillis, TimeUnit.MILLISECONDS, true);
    }

    @Bean
    public Level feignLoggerLevel() {
        return BASIC;
    }
}
