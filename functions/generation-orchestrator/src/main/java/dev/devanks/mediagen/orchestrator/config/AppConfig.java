package dev.devanks.mediagen.orchestrator.config;

import com.google.common.base.Ticker;
import dev.devanks.mediagen.orchestrator.service.PollSleeper;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class AppConfig {

    // generated videos are buffered whole before decoding
    private static final int MAX_IN_MEMORY_BYTES = 256 * 1024 * 1024;

    @Bean
    public WebClient webClient(OrchestratorProperties properties) {
        log.info("Initializing WebClient bean for media transfers.");
        int timeoutMillis = (int) Duration.ofSeconds(properties.getTimeoutSeconds()).toMillis();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMillis)
                .responseTimeout(Duration.ofMillis(timeoutMillis))
                .followRedirect(true);
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                        .build())
                .build();
    }

    @Bean
    public Ticker pollTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public PollSleeper pollSleeper() {
        return PollSleeper.threadSleep();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
