// functions/generation-orchestrator/src/main/java/dev/devanks/mediagen/orchestrator/config/OrchestratorProperties.java
package dev.devanks.mediagen.orchestrator.config;

import dev.devanks.mediagen.orchestrator.model.OutputKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Raw, bindable configuration. Orchestration code never reads this directly; it works on the
 * immutable {@link OrchestratorSettings} snapshot handed out by {@link SettingsStore}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = OrchestratorProperties.PREFIX)
public class OrchestratorProperties {

    public static final String PREFIX = "orchestrator";

    /**
     * Connect/read timeout of every single HTTP call.
     */
    @Positive
    private int timeoutSeconds = 30;

    /**
     * Wall-clock budget for one task to reach a terminal state.
     */
    @Positive
    private int maxWaitSeconds = 300;

    /**
     * Fixed wait between two status queries. No backoff.
     */
    @Positive
    private int pollIntervalSeconds = 3;

    @Min(1)
    @Max(4)
    private int maxAssetsPerTask = 4;

    @Valid
    @NotNull
    private PlaceholderSize defaultPlaceholderSize = new PlaceholderSize();

    /**
     * Language of the diagnostics written into a fallback result.
     */
    @NotNull
    private Locale locale = Locale.ENGLISH;

    @Valid
    @NotNull
    private HaiyiProperties haiyi = new HaiyiProperties();

    @Valid
    @NotNull
    private DashScopeProperties dashscope = new DashScopeProperties();

    @Data
    public static class PlaceholderSize {
        @Positive
        private int width = 256;
        @Positive
        private int height = 256;
    }

    @Data
    @Validated
    public static class HaiyiProperties {
        @NotEmpty
        @URL
        private String baseUrl = "https://www.haiyi.art";

        private String cookie; // Injected from the environment, checked per invocation

        @Valid
        @NotNull
        private HeaderProperties headers = new HeaderProperties();

        /**
         * Shard used to query tasks whose model is unknown (manual status checks).
         */
        private int defaultSs = 52;

        @Valid
        private Map<String, ModelProperties> models = new LinkedHashMap<>();
    }

    @Data
    public static class HeaderProperties {
        private String origin = "https://www.haiyi.art";
        private String referer = "https://www.haiyi.art/";
        private String userAgent = "Mozilla/5.0";
        private String appId = "web_global_seaart";
        private String platform = "web";
    }

    @Data
    public static class ModelProperties {
        @NotNull
        private OutputKind output = OutputKind.SINGLE_VIDEO;
        @NotNull
        private ModelProfile.SubmitFlow flow = ModelProfile.SubmitFlow.TASK;
        private String modelNo;
        private String modelVerNo;
        private String applyId;
        private String verNo;
        private int ss = 52;
        private boolean multiReference = false;
        private NodeBinding promptNode;
        private NodeBinding imageNode;
        private NodeBinding ratioNode;
        private NodeBinding resolutionNode;
    }

    /**
     * Where a value goes inside an "apply" workflow: {@code {"node_id": .., "node_type": .., "field": ..}}.
     */
    @Data
    public static class NodeBinding {
        private String nodeId;
        private String nodeType;
        private String field;
    }

    @Data
    @Validated
    public static class DashScopeProperties {
        @NotEmpty
        @URL
        private String baseUrl = "https://dashscope.aliyuncs.com";

        private String apiKey; // Injected from the environment, checked per invocation

        @Valid
        private Map<String, DashScopeModelProperties> models = new LinkedHashMap<>();
    }

    @Data
    public static class DashScopeModelProperties {
        @NotNull
        private OutputKind output = OutputKind.SINGLE_VIDEO;
        /**
         * Model name as DashScope knows it, e.g. wan2.2-t2v-plus.
         */
        private String model;
        @NotNull
        private ModelProfile.VideoMode videoMode = ModelProfile.VideoMode.TEXT_TO_VIDEO;
        private boolean promptExtend = true;
        private boolean watermark = false;
        @Min(1)
        @Max(4)
        private int imageCount = 1;
    }
}
