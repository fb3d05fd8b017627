package dev.devanks.mediagen.orchestrator.config;

import com.google.common.collect.ImmutableMap;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only configuration snapshot shared by all invocations. A new instance replaces the old one on reload;
 * an instance itself never changes.
 */
@Value
@Builder(toBuilder = true)
public class OrchestratorSettings {

    Duration callTimeout;
    Duration maxWait;
    Duration pollInterval;
    int maxAssetsPerTask;
    int placeholderWidth;
    int placeholderHeight;
    Locale locale;
    String baseUrl;
    String cookie;
    ImmutableMap<String, String> headers;
    int defaultSs;
    String dashScopeBaseUrl;
    String dashScopeApiKey;
    ImmutableMap<String, ModelProfile> models;

    public static OrchestratorSettings from(OrchestratorProperties properties) {
        var haiyi = properties.getHaiyi();
        var headerProps = haiyi.getHeaders();
        var headers = ImmutableMap.<String, String>builder()
                .put("accept", "application/json, text/plain, */*")
                .put("origin", headerProps.getOrigin())
                .put("referer", headerProps.getReferer())
                .put("user-agent", headerProps.getUserAgent())
                .put("x-app-id", headerProps.getAppId())
                .put("x-platform", headerProps.getPlatform())
                .build();

        var dashscope = properties.getDashscope();
        Map<String, ModelProfile> models = new LinkedHashMap<>();
        haiyi.getModels().forEach((key, model) -> models.put(key, ModelProfile.from(key, model)));
        dashscope.getModels().forEach((key, model) -> {
            if (models.containsKey(key)) {
                throw new ConfigurationException("Model key " + key
                        + " is configured under both orchestrator.haiyi.models and orchestrator.dashscope.models");
            }
            models.put(key, ModelProfile.from(key, model));
        });

        return OrchestratorSettings.builder()
                .callTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .maxWait(Duration.ofSeconds(properties.getMaxWaitSeconds()))
                .pollInterval(Duration.ofSeconds(properties.getPollIntervalSeconds()))
                .maxAssetsPerTask(properties.getMaxAssetsPerTask())
                .placeholderWidth(properties.getDefaultPlaceholderSize().getWidth())
                .placeholderHeight(properties.getDefaultPlaceholderSize().getHeight())
                .locale(properties.getLocale())
                .baseUrl(haiyi.getBaseUrl())
                .cookie(haiyi.getCookie() == null ? null : haiyi.getCookie().trim())
                .headers(headers)
                .defaultSs(haiyi.getDefaultSs())
                .dashScopeBaseUrl(dashscope.getBaseUrl())
                .dashScopeApiKey(dashscope.getApiKey() == null ? null : dashscope.getApiKey().trim())
                .models(ImmutableMap.copyOf(models))
                .build();
    }

    /**
     * @throws ConfigurationException when the vendor's secret is absent or still an unresolved secret reference
     */
    public void requireCredentials(Vendor vendor) {
        if (vendor == Vendor.DASHSCOPE) {
            if (isMissing(dashScopeApiKey)) {
                throw new ConfigurationException("DashScope API key is missing or unresolved. Set orchestrator.dashscope.api-key.");
            }
        } else if (isMissing(cookie)) {
            throw new ConfigurationException("Haiyi cookie is missing or unresolved. Set orchestrator.haiyi.cookie.");
        }
    }

    public ModelProfile model(String key) {
        ModelProfile profile = models.get(key);
        if (profile == null) {
            throw new ConfigurationException("No model configured under orchestrator.haiyi.models." + key
                    + " or orchestrator.dashscope.models." + key + ". Known models: " + models.keySet());
        }
        return profile;
    }

    private static boolean isMissing(String secret) {
        return secret == null || secret.isBlank() || secret.startsWith("sm://");
    }
}
