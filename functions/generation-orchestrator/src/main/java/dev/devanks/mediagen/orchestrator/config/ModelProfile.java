package dev.devanks.mediagen.orchestrator.config;

import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable copy of one configured model, Haiyi or DashScope.
 */
@Value
@Builder(toBuilder = true)
public class ModelProfile {

    public enum SubmitFlow {
        /** model_no/model_ver_no task endpoints (text-to-img, text/img/multi-img-to-video) */
        TASK,
        /** workflow apps addressed by apply_id, inputs bound to workflow nodes */
        APPLY
    }

    /**
     * Input shape of a DashScope video model. Fixed per model, unlike Haiyi where references pick the route.
     */
    public enum VideoMode {
        TEXT_TO_VIDEO,
        IMAGE_TO_VIDEO,
        KEYFRAME_TO_VIDEO
    }

    String key;
    @Builder.Default
    Vendor vendor = Vendor.HAIYI;
    OutputKind output;
    SubmitFlow flow;
    String modelNo;
    String modelVerNo;
    String applyId;
    String verNo;
    int ss;
    boolean multiReference;
    InputNode promptNode;
    InputNode imageNode;
    InputNode ratioNode;
    InputNode resolutionNode;

    // DashScope only
    String vendorModel;
    VideoMode videoMode;
    boolean promptExtend;
    boolean watermark;
    int imageCount;

    @Value
    public static class InputNode {
        String nodeId;
        String nodeType;
        String field;

        static InputNode from(OrchestratorProperties.NodeBinding binding) {
            return binding == null ? null : new InputNode(binding.getNodeId(), binding.getNodeType(), binding.getField());
        }
    }

    /**
     * Id the vendor wants uploads tagged with.
     */
    public String uploadScope() {
        if (vendor == Vendor.DASHSCOPE) {
            return vendorModel;
        }
        return flow == SubmitFlow.APPLY ? applyId : modelNo;
    }

    static ModelProfile from(String key, OrchestratorProperties.ModelProperties model) {
        return ModelProfile.builder()
                .key(key)
                .vendor(Vendor.HAIYI)
                .output(model.getOutput())
                .flow(model.getFlow())
                .modelNo(model.getModelNo())
                .modelVerNo(model.getModelVerNo())
                .applyId(model.getApplyId())
                .verNo(model.getVerNo())
                .ss(model.getSs())
                .multiReference(model.isMultiReference())
                .promptNode(InputNode.from(model.getPromptNode()))
                .imageNode(InputNode.from(model.getImageNode()))
                .ratioNode(InputNode.from(model.getRatioNode()))
                .resolutionNode(InputNode.from(model.getResolutionNode()))
                .build();
    }

    static ModelProfile from(String key, OrchestratorProperties.DashScopeModelProperties model) {
        return ModelProfile.builder()
                .key(key)
                .vendor(Vendor.DASHSCOPE)
                .output(model.getOutput())
                .vendorModel(model.getModel())
                .videoMode(model.getVideoMode())
                .promptExtend(model.isPromptExtend())
                .watermark(model.isWatermark())
                .imageCount(model.getImageCount())
                .build();
    }
}
