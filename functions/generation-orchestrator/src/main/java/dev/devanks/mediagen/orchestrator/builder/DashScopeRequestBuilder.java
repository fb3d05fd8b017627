package dev.devanks.mediagen.orchestrator.builder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import dev.devanks.mediagen.orchestrator.backend.DashScopeRoute;
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

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Payloads for the asynchronous DashScope endpoints: {@code {"model", "input": {...}, "parameters": {...}}}.
 * Video models have a fixed input shape ({@link ModelProfile.VideoMode}); image models are text-to-image only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DashScopeRequestBuilder implements RequestBuilder {

    private static final String DEFAULT_TIER = "720P";
    private static final String KEYFRAME_SIZE = "1280*720";

    private static final Map<String, Map<String, String>> VIDEO_SIZES = ImmutableMap.of(
            "480P", ImmutableMap.of("16:9", "832*480", "9:16", "480*832", "1:1", "624*624"),
            "720P", ImmutableMap.of("16:9", "1280*720", "9:16", "720*1280", "1:1", "960*960",
                    "4:3", "960*720", "3:4", "720*960"),
            "1080P", ImmutableMap.of("16:9", "1920*1080", "9:16", "1080*1920", "1:1", "1440*1440",
                    "4:3", "1632*1248", "3:4", "1248*1632"));

    private static final Map<String, String> IMAGE_SIZES = ImmutableMap.of(
            "1:1", "1024*1024",
            "3:4", "864*1152",
            "4:3", "1152*864",
            "9:16", "768*1344",
            "16:9", "1344*768");
    private static final String DEFAULT_IMAGE_SIZE = "1024*1024";

    private final ObjectMapper objectMapper;

    @Override
    public Vendor vendor() {
        return Vendor.DASHSCOPE;
    }

    @Override
    public void validate(ModelProfile model) {
        if (model.getVendorModel() == null || model.getVendorModel().isBlank()) {
            throw new ConfigurationException("Model " + model.getKey() + " has no DashScope model name");
        }
        if (model.getOutput() == OutputKind.SINGLE_VIDEO && model.getVideoMode() == null) {
            throw new ConfigurationException("Video model " + model.getKey() + " has no video-mode");
        }
        if (model.getOutput() == OutputKind.IMAGE_BATCH && (model.getImageCount() < 1 || model.getImageCount() > 4)) {
            throw new ConfigurationException("Model " + model.getKey() + " asks for " + model.getImageCount()
                    + " images, DashScope allows 1 to 4");
        }
    }

    @Override
    public SubmissionVariant variantFor(GenerationRequest request, ModelProfile model) {
        int references = request.getReferences().size();
        if (model.getOutput() == OutputKind.IMAGE_BATCH) {
            if (references > 0) {
                log.warn("text-to-image model {} takes no references, ignoring {} reference(s).", model.getKey(), references);
            }
            return SubmissionVariant.TEXT_ONLY;
        }

        videoSize(model.getVideoMode(), request.getResolution(), request.getAspectRatio());
        return switch (model.getVideoMode()) {
            case TEXT_TO_VIDEO -> {
                if (references > 0) {
                    log.warn("text-to-video model {} takes no references, ignoring {} reference(s).", model.getKey(), references);
                }
                yield SubmissionVariant.TEXT_ONLY;
            }
            case IMAGE_TO_VIDEO -> {
                requireReference(model, references);
                yield SubmissionVariant.SINGLE_IMAGE;
            }
            case KEYFRAME_TO_VIDEO -> {
                requireReference(model, references);
                if (references > 2) {
                    log.warn("Keyframe model {} uses the first and last frame only, ignoring {} reference(s).",
                            model.getKey(), references - 2);
                }
                yield SubmissionVariant.MULTI_IMAGE;
            }
        };
    }

    @Override
    public VendorSubmission build(GenerationRequest request, ModelProfile model, List<String> referenceUrls) {
        validate(model);
        SubmissionVariant variant = variantFor(request, model);
        if (variant != SubmissionVariant.TEXT_ONLY && referenceUrls.isEmpty()) {
            throw new IllegalArgumentException(variant + " submission needs at least one uploaded reference");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", model.getVendorModel());
        ObjectNode input = payload.putObject("input");
        input.put("prompt", request.getPrompt());
        ObjectNode parameters = payload.putObject("parameters");
        parameters.put("prompt_extend", model.isPromptExtend());
        parameters.put("watermark", model.isWatermark());

        VendorSubmission.VendorSubmissionBuilder submission = VendorSubmission.builder().variant(variant);

        if (model.getOutput() == OutputKind.IMAGE_BATCH) {
            parameters.put("size", IMAGE_SIZES.getOrDefault(request.getAspectRatio(), DEFAULT_IMAGE_SIZE));
            parameters.put("n", model.getImageCount());
            return submission.route(DashScopeRoute.IMAGE_SYNTHESIS.name()).payload(payload).build();
        }

        parameters.put("size", videoSize(model.getVideoMode(), request.getResolution(), request.getAspectRatio()));
        parameters.put("duration", request.getDurationSeconds());
        if (variant == SubmissionVariant.MULTI_IMAGE) {
            input.put("first_frame_url", referenceUrls.get(0));
            if (referenceUrls.size() > 1) {
                input.put("last_frame_url", referenceUrls.get(1));
            }
            return submission.route(DashScopeRoute.KEYFRAME_VIDEO.name()).payload(payload).build();
        }
        if (variant == SubmissionVariant.SINGLE_IMAGE) {
            input.put("img_url", referenceUrls.get(0));
        }
        return submission.route(DashScopeRoute.VIDEO_SYNTHESIS.name()).payload(payload).build();
    }

    /**
     * Keyframe models only render 720P. Unknown tiers fall back to 720P; a ratio the tier lacks is an error.
     */
    @VisibleForTesting
    static String videoSize(ModelProfile.VideoMode mode, String resolution, String aspectRatio) {
        if (mode == ModelProfile.VideoMode.KEYFRAME_TO_VIDEO) {
            return KEYFRAME_SIZE;
        }
        String tier = resolution == null ? DEFAULT_TIER : resolution.trim().toUpperCase(Locale.ROOT);
        Map<String, String> byRatio = VIDEO_SIZES.get(tier);
        if (byRatio == null) {
            log.warn("DashScope has no {} tier, using {}.", resolution, DEFAULT_TIER);
            tier = DEFAULT_TIER;
            byRatio = VIDEO_SIZES.get(DEFAULT_TIER);
        }
        String size = byRatio.get(aspectRatio);
        if (size == null) {
            throw new IllegalArgumentException("DashScope " + tier + " video has no " + aspectRatio
                    + " size, supported: " + byRatio.keySet());
        }
        return size;
    }

    private static void requireReference(ModelProfile model, int references) {
        if (references == 0) {
            throw new IllegalArgumentException("Model " + model.getKey() + " (" + model.getVideoMode()
                    + ") needs at least one reference image");
        }
    }
}
