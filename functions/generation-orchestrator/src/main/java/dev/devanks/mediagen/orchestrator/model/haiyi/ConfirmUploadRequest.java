package dev.devanks.mediagen.orchestrator.model.haiyi;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmUploadRequest {

    @JsonProperty("category")
    private int category;

    @JsonProperty("file_id")
    private String fileId;

    @JsonProperty("template_id")
    private String templateId;
}
