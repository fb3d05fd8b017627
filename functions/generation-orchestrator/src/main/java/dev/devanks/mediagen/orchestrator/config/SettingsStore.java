package dev.devanks.mediagen.orchestrator.config;

import com.google.common.base.Throwables;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.validation.ValidationBindHandler;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.validation.beanvalidation.SpringValidatorAdapter;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link OrchestratorSettings}. Built once at startup; only {@link #reload()} replaces it.
 */
@Component
@Slf4j
public class SettingsStore {

    private final Environment environment;
    private final Validator validator;
    private final AtomicReference<OrchestratorSettings> current;

    public SettingsStore(OrchestratorProperties properties, Environment environment, Validator validator) {
        this.environment = environment;
        this.validator = validator;
        this.current = new AtomicReference<>(OrchestratorSettings.from(properties));
        log.info("Loaded orchestrator settings with {} model(s).", current.get().getModels().size());
    }

    public OrchestratorSettings current() {
        return current.get();
    }

    /**
     * Rebinds and validates {@code orchestrator.*} from the environment, then swaps the snapshot.
     * Invocations already running keep the snapshot they started with.
     *
     * @throws ConfigurationException when the section is missing or fails validation; the previous snapshot stays
     */
    public OrchestratorSettings reload() {
        OrchestratorProperties fresh;
        try {
            fresh = Binder.get(environment)
                    .bind(OrchestratorProperties.PREFIX, Bindable.of(OrchestratorProperties.class),
                            new ValidationBindHandler(new SpringValidatorAdapter(validator)))
                    .orElseThrow(() -> new ConfigurationException(
                            "No " + OrchestratorProperties.PREFIX + ".* properties found, keeping the current settings"));
        } catch (BindException e) {
            String reason = Throwables.getRootCause(e).getMessage();
            log.error("Reloaded orchestrator settings are invalid, keeping the current ones: {}", reason);
            throw new ConfigurationException("Invalid " + OrchestratorProperties.PREFIX + ".* properties: " + reason, e);
        }

        OrchestratorSettings settings = OrchestratorSettings.from(fresh);
        current.set(settings);
        log.info("Reloaded orchestrator settings with {} model(s).", settings.getModels().size());
        return settings;
    }
}
