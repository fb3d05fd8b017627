package dev.devanks.mediagen.orchestrator.model.haiyi;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PresignRequest {

    public static final int CATEGORY_REFERENCE_IMAGE = 20;

    @JsonProperty("content_type")
    private String contentType;

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("file_size")
    private long fileSize;

    @JsonProperty("category")
    private int category;

    @JsonProperty("hash_val")
    private String hashVal; // sha256 hex of the raw bytes

    @JsonProperty("template_id")
    private String templateId;
}
