package dev.devanks.mediagen.orchestrator.model.haiyi;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchProgressRequest {

    @JsonProperty("task_ids")
    private List<String> taskIds;

    @JsonProperty("ss")
    private Integer ss;
}
