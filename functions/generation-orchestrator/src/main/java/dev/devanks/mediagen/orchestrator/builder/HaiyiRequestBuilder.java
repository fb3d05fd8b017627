package dev.devanks.mediagen.orchestrator.builder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import dev.devanks.mediagen.orchestrator.backend.HaiyiRoute;
import dev.devanks.mediagen.orchestrator.config.ModelProfile;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.GenerationRequest;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.SubmissionVariant;
import dev.devanks.mediagen.orchestrator.model.Vendor;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Payloads for the Haiyi task API. Two families:
 * <ul>
 *     <li>TASK models, addressed by {@code model_no}/{@code model_ver_no}: text-to-img and the three video routes.</li>
 *     <li>APPLY workflow apps, addressed by {@code apply_id}, whose inputs are bound to workflow nodes.</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HaiyiRequestBuilder implements RequestBuilder {

    private static final int MULTI_REFERENCE_DOMAIN_TYPE = 25;
    private static final long SEED_MODULUS = 4_294_967_295L;

    private static final Map<String, Map<String, int[]>> VIDEO_SIZES = ImmutableMap.of(
            "360p", ImmutableMap.of("16:9", new int[]{640, 360}, "9:16", new int[]{360, 640}),
            "720p", ImmutableMap.of("16:9", new int[]{1280, 720}, "9:16", new int[]{720, 1280}),
            "1080p", ImmutableMap.of("16:9", new int[]{1920, 1080}, "9:16", new int[]{1080, 1920}));
    private static final int[] DEFAULT_VIDEO_SIZE = {640, 360};

    private static final Map<String, int[]> IMAGE_SIZES = ImmutableMap.of(
            "1:1", new int[]{2048, 2048},
            "3:4", new int[]{1536, 2048},
            "4:3", new int[]{2048, 1536},
            "9:16", new int[]{1152, 2048},
            "16:9", new int[]{2048, 1152});
    private static final int[] DEFAULT_IMAGE_SIZE = {1024, 1024};

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Vendor vendor() {
        return Vendor.HAIYI;
    }

    @Override
    public void validate(ModelProfile model) {
        if (model.getFlow() == ModelProfile.SubmitFlow.APPLY) {
            if (isBlank(model.getApplyId())) {
                throw new ConfigurationException("Model " + model.getKey() + " uses the apply flow but has no apply-id");
            }
        } else if (isBlank(model.getModelNo()) || isBlank(model.getModelVerNo())) {
            throw new ConfigurationException("Model " + model.getKey() + " is missing model-no or model-ver-no");
        }
    }

    @Override
    public SubmissionVariant variantFor(GenerationRequest request, ModelProfile model) {
        int references = request.getReferences().size();
        if (references == 0) {
            return SubmissionVariant.TEXT_ONLY;
        }
        if (model.getFlow() == ModelProfile.SubmitFlow.APPLY) {
            if (model.getImageNode() == null) {
                log.warn("Model {} has no image node, ignoring {} reference(s).", model.getKey(), references);
                return SubmissionVariant.TEXT_ONLY;
            }
            return SubmissionVariant.SINGLE_IMAGE;
        }
        if (model.getOutput() == OutputKind.IMAGE_BATCH) {
            log.warn("text-to-img model {} takes no references, ignoring {} reference(s).", model.getKey(), references);
            return SubmissionVariant.TEXT_ONLY;
        }
        if (references >= 2 || model.isMultiReference()) {
            return SubmissionVariant.MULTI_IMAGE;
        }
        return SubmissionVariant.SINGLE_IMAGE;
    }

    @Override
    public VendorSubmission build(GenerationRequest request, ModelProfile model, List<String> referenceUrls) {
        validate(model);
        SubmissionVariant variant = variantFor(request, model);
        if (variant != SubmissionVariant.TEXT_ONLY && referenceUrls.isEmpty()) {
            throw new IllegalArgumentException(variant + " submission needs at least one uploaded reference");
        }

        VendorSubmission.VendorSubmissionBuilder submission = VendorSubmission.builder()
                .routingKey(String.valueOf(model.getSs()))
                .variant(variant);

        if (model.getFlow() == ModelProfile.SubmitFlow.APPLY) {
            return submission.route(HaiyiRoute.APPLY.name())
                    .payload(applyPayload(request, model, variant, referenceUrls))
                    .build();
        }

        if (model.getOutput() == OutputKind.IMAGE_BATCH) {
            return submission.route(HaiyiRoute.TEXT_TO_IMAGE.name())
                    .payload(textToImagePayload(request, model))
                    .build();
        }
        return switch (variant) {
            case TEXT_ONLY -> submission.route(HaiyiRoute.TEXT_TO_VIDEO.name())
                    .payload(videoPayload(request, model, request.getAspectRatio()))
                    .build();
            case SINGLE_IMAGE -> submission.route(HaiyiRoute.IMAGE_TO_VIDEO.name())
                    .payload(imageToVideoPayload(request, model, referenceUrls.get(0)))
                    .build();
            case MULTI_IMAGE -> submission.route(HaiyiRoute.MULTI_IMAGE_TO_VIDEO.name())
                    .payload(multiImageToVideoPayload(request, model, referenceUrls))
                    .build();
        };
    }

    @VisibleForTesting
    static int[] videoSize(String aspectRatio, String resolution) {
        Map<String, int[]> byRatio = VIDEO_SIZES.getOrDefault(resolution, VIDEO_SIZES.get("360p"));
        return byRatio.getOrDefault(aspectRatio, DEFAULT_VIDEO_SIZE);
    }

    @VisibleForTesting
    static int[] imageSize(String aspectRatio) {
        return IMAGE_SIZES.getOrDefault(aspectRatio, DEFAULT_IMAGE_SIZE);
    }

    private ObjectNode textToImagePayload(GenerationRequest request, ModelProfile model) {
        int[] size = imageSize(request.getAspectRatio());
        ObjectNode payload = taskHeader(model);
        payload.put("channel_id", "");
        payload.put("speed_type", 2);

        ObjectNode meta = payload.putObject("meta");
        meta.put("prompt", request.getPrompt());
        meta.put("negative_prompt", "");
        meta.put("width", size[0]);
        meta.put("height", size[1]);
        meta.put("steps", 20);
        meta.put("cfg_scale", 2.5);
        meta.put("sampler_name", "");
        meta.put("n_iter", 4);
        meta.putArray("lora_models");
        meta.put("vae", "None");
        meta.put("clip_skip", 0);
        meta.put("seed", (clock.millis() / 1000) % SEED_MODULUS);
        meta.put("restore_faces", false);
        meta.putArray("embeddings");
        ObjectNode generate = meta.putObject("generate");
        generate.put("anime_enhance", 0);
        generate.put("mode", 0);
        generate.put("gen_mode", 1);
        generate.put("prompt_magic_mode", 2);
        meta.put("original_translated_meta_prompt", request.getPrompt());
        meta.put("artwork_remix_local_prompt", request.getPrompt());

        payload.put("ss", model.getSs());
        return payload;
    }

    private ObjectNode videoPayload(GenerationRequest request, ModelProfile model, String metaAspectRatio) {
        int[] size = videoSize(request.getAspectRatio(), request.getResolution());
        ObjectNode payload = taskHeader(model);

        ObjectNode meta = payload.putObject("meta");
        meta.put("prompt", request.getPrompt());
        ObjectNode video = meta.putObject("generate_video");
        video.put("relevance", 0.5);
        ObjectNode camera = video.putObject("camera_control_option");
        camera.put("mode", "Camera Movement");
        camera.put("offset", 0);
        video.put("generate_video_duration", request.getDurationSeconds());
        video.put("quality_mode", request.getResolution());
        video.put("audio_effect", request.isAudioEffect());
        video.put("n_iter", 1);
        meta.put("width", size[0]);
        meta.put("height", size[1]);
        meta.putArray("lora_models");
        meta.put("aspect_ratio", metaAspectRatio);
        ObjectNode generate = meta.putObject("generate");
        generate.put("anime_enhance", 2);
        generate.put("mode", 0);
        generate.put("gen_mode", request.isHdMode() ? 1 : 0);
        meta.put("n_iter", 1);
        meta.put("original_translated_meta_prompt", "");

        payload.put("ss", model.getSs());
        return payload;
    }

    private ObjectNode imageToVideoPayload(GenerationRequest request, ModelProfile model, String firstFrameUrl) {
        // the first frame fixes the aspect ratio, so meta.aspect_ratio stays empty
        ObjectNode payload = videoPayload(request, model, "");
        ObjectNode firstFrame = objectMapper.createObjectNode();
        firstFrame.put("mode", "first_frame");
        firstFrame.put("url", firstFrameUrl);
        ((ObjectNode) payload.get("meta").get("generate_video")).putArray("image_opts").add(firstFrame);
        return payload;
    }

    private ObjectNode multiImageToVideoPayload(GenerationRequest request, ModelProfile model, List<String> urls) {
        int[] size = videoSize(request.getAspectRatio(), request.getResolution());
        ObjectNode payload = taskHeader(model);

        ObjectNode meta = payload.putObject("meta");
        meta.put("prompt", request.getPrompt());
        meta.put("height", size[1]);
        meta.put("width", size[0]);
        meta.put("negative_prompt", "");
        meta.put("aspect_ratio", request.getAspectRatio());
        meta.putObject("generate").put("gen_mode", request.isHdMode() ? 1 : 0);
        ObjectNode video = meta.putObject("generate_video");
        video.put("generate_video_duration", request.getDurationSeconds());
        video.put("audio_effect", request.isAudioEffect());
        video.put("movement_amplitude", "auto");
        ArrayNode imageOpts = video.putArray("image_opts");
        urls.forEach(url -> imageOpts.addObject().put("url", url));
        meta.put("original_translated_meta_prompt", "");

        payload.put("task_domain_type", MULTI_REFERENCE_DOMAIN_TYPE);
        payload.put("ss", model.getSs());
        return payload;
    }

    private ObjectNode applyPayload(GenerationRequest request, ModelProfile model, SubmissionVariant variant,
                                    List<String> referenceUrls) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("apply_id", model.getApplyId());
        ArrayNode inputs = payload.putArray("inputs");
        if (variant == SubmissionVariant.SINGLE_IMAGE) {
            addInput(inputs, model.getImageNode(), referenceUrls.get(0));
        }
        addInput(inputs, model.getPromptNode(), request.getPrompt());
        addInput(inputs, model.getResolutionNode(), request.getResolution());
        addInput(inputs, model.getRatioNode(), request.getAspectRatio());
        if (model.getVerNo() != null && !model.getVerNo().isBlank()) {
            payload.put("ver_no", model.getVerNo());
        }
        payload.put("ss", model.getSs());
        log.debug("Apply payload for {} has {} input(s).", model.getKey(), inputs.size());
        return payload;
    }

    private static void addInput(ArrayNode inputs, ModelProfile.InputNode node, String value) {
        if (node == null) {
            return;
        }
        ObjectNode input = inputs.addObject();
        input.put("field", node.getField());
        input.put("node_id", node.getNodeId());
        input.put("node_type", node.getNodeType());
        input.put("val", value);
    }

    private ObjectNode taskHeader(ModelProfile model) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model_no", model.getModelNo());
        payload.put("model_ver_no", model.getModelVerNo());
        return payload;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
