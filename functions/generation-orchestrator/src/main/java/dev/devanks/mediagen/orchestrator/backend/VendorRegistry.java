package dev.devanks.mediagen.orchestrator.backend;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import dev.devanks.mediagen.orchestrator.builder.RequestBuilder;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Looks up the backend and request builder of a vendor. One of each per vendor.
 */
@Component
@Slf4j
public class VendorRegistry {

    private final ImmutableMap<Vendor, GenerationBackend> backends;
    private final ImmutableMap<Vendor, RequestBuilder> builders;

    public VendorRegistry(List<GenerationBackend> backends, List<RequestBuilder> builders) {
        this.backends = Maps.uniqueIndex(backends, GenerationBackend::vendor);
        this.builders = Maps.uniqueIndex(builders, RequestBuilder::vendor);
        log.info("Registered backends {} and request builders {}.", this.backends.keySet(), this.builders.keySet());
    }

    public RequestBuilder builder(Vendor vendor) {
        RequestBuilder builder = builders.get(vendor);
        if (builder == null) {
            throw new ConfigurationException("No request builder registered for " + vendor);
        }
        return builder;
    }

    /**
     * @return the vendor's backend bound to {@code settings}
     */
    public BackendSession session(Vendor vendor, OrchestratorSettings settings) {
        GenerationBackend backend = backends.get(vendor);
        if (backend == null) {
            throw new ConfigurationException("No generation backend registered for " + vendor);
        }
        return new BackendSession(backend, settings);
    }
}
