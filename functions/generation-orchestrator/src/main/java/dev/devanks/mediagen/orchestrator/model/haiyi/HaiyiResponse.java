// functions/generation-orchestrator/src/main/java/dev/devanks/mediagen/orchestrator/model/haiyi/HaiyiResponse.java
package dev.devanks.mediagen.orchestrator.model.haiyi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope shared by every Haiyi endpoint: {@code {"status": {"code": 10000, "msg": ""}, "data": {...}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class HaiyiResponse<T> {

    public static final int CODE_OK = 10000;
    public static final int CODE_SENSITIVE_CONTENT = 70026;

    @JsonProperty("status")
    private Status status;

    @JsonProperty("data")
    private T data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Status {
        @JsonProperty("code")
        private Integer code;

        @JsonProperty("msg")
        private String msg;
    }

    public Integer code() {
        return status != null ? status.getCode() : null;
    }

    public String message() {
        return status != null && status.getMsg() != null ? status.getMsg() : "";
    }

    public boolean isOk() {
        return Integer.valueOf(CODE_OK).equals(code());
    }
}
