package dev.devanks.mediagen.orchestrator.model.haiyi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Payload of {@code /api/v1/task/batch-progress}. We always ask for a single task, so only
 * the first item matters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchProgress {

    @JsonProperty("items")
    private List<Item> items;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        @JsonProperty("id")
        private String id;

        @JsonProperty("status")
        private Integer status; // 1 waiting, 2 processing, 3 finished, 4 cancelled by the platform, 5 failed

        @JsonProperty("process")
        private Integer process; // percent

        @JsonProperty("img_uris")
        private List<ImageUri> imgUris;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ImageUri {
        @JsonProperty("index")
        private Integer index;

        @JsonProperty("url")
        private String url;

        @JsonProperty("cover_url")
        private String coverUrl;
    }
}
