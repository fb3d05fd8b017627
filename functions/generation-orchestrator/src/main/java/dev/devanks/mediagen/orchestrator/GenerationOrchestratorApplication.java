package dev.devanks.mediagen.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication
@EnableFeignClients
public class GenerationOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenerationOrchestratorApplication.class, args);
    }
}
