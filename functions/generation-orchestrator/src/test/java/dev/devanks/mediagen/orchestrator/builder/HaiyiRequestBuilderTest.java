package dev.devanks.mediagen.orchestrator.builder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.mediagen.orchestrator.TestFixtures;
import dev.devanks.mediagen.orchestrator.backend.HaiyiRoute;
import dev.devanks.mediagen.orchestrator.config.ModelProfile;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.GenerationRequest;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.SourceAsset;
import dev.devanks.mediagen.orchestrator.model.SubmissionVariant;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HaiyiRequestBuilder Unit Tests")
class HaiyiRequestBuilderTest {

    private static final SourceAsset REFERENCE = SourceAsset.builder().sourceRef("ref").bytes(new byte[]{1}).build();

    private final OrchestratorSettings settings = TestFixtures.settings();
    private final HaiyiRequestBuilder builder = new HaiyiRequestBuilder(new ObjectMapper(),
            Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC));

    @Test
    @DisplayName("variantFor: reference count decides the video variant")
    void variantFor_video() {
        ModelProfile video = settings.model(TestFixtures.VIDEO_MODEL);

        assertThat(builder.variantFor(videoRequest(0), video)).isEqualTo(SubmissionVariant.TEXT_ONLY);
        assertThat(builder.variantFor(videoRequest(1), video)).isEqualTo(SubmissionVariant.SINGLE_IMAGE);
        assertThat(builder.variantFor(videoRequest(2), video)).isEqualTo(SubmissionVariant.MULTI_IMAGE);
        assertThat(builder.variantFor(videoRequest(1), settings.model(TestFixtures.MULTI_VIDEO_MODEL)))
                .isEqualTo(SubmissionVariant.MULTI_IMAGE);
    }

    @Test
    @DisplayName("variantFor: text-to-img ignores references, apply apps use one")
    void variantFor_image() {
        GenerationRequest withReferences = GenerationRequest.builder()
                .modelKey("x").outputKind(OutputKind.IMAGE_BATCH).reference(REFERENCE).reference(REFERENCE).build();

        assertThat(builder.variantFor(withReferences, settings.model(TestFixtures.IMAGE_MODEL)))
                .isEqualTo(SubmissionVariant.TEXT_ONLY);
        assertThat(builder.variantFor(withReferences, settings.model(TestFixtures.APP_MODEL)))
                .isEqualTo(SubmissionVariant.SINGLE_IMAGE);
    }

    @Test
    @DisplayName("build: text-to-video payload uses the size table and the model shard")
    void build_textToVideo() {
        GenerationRequest request = GenerationRequest.builder()
                .modelKey(TestFixtures.VIDEO_MODEL)
                .prompt("sunrise")
                .outputKind(OutputKind.SINGLE_VIDEO)
                .aspectRatio("9:16")
                .resolution("720p")
                .durationSeconds(10)
                .hdMode(true)
                .build();

        VendorSubmission submission = builder.build(request, settings.model(TestFixtures.VIDEO_MODEL), List.of());

        assertThat(submission.getRoute()).isEqualTo(HaiyiRoute.TEXT_TO_VIDEO.name());
        assertThat(submission.getRoutingKey()).isEqualTo("52");
        JsonNode payload = submission.getPayload();
        assertThat(payload.get("model_no").asText()).isEqualTo("video-model-no");
        assertThat(payload.get("ss").asInt()).isEqualTo(52);
        JsonNode meta = payload.get("meta");
        assertThat(meta.get("prompt").asText()).isEqualTo("sunrise");
        assertThat(meta.get("width").asInt()).isEqualTo(720);
        assertThat(meta.get("height").asInt()).isEqualTo(1280);
        assertThat(meta.get("aspect_ratio").asText()).isEqualTo("9:16");
        assertThat(meta.get("generate").get("gen_mode").asInt()).isEqualTo(1);
        assertThat(meta.get("generate_video").get("generate_video_duration").asInt()).isEqualTo(10);
        assertThat(meta.get("generate_video").get("quality_mode").asText()).isEqualTo("720p");
    }

    @Test
    @DisplayName("build: single image uses the first frame option")
    void build_imageToVideo() {
        VendorSubmission submission = builder.build(videoRequest(1), settings.model(TestFixtures.VIDEO_MODEL),
                List.of("https://cdn/ref-0.png"));

        assertThat(submission.getRoute()).isEqualTo(HaiyiRoute.IMAGE_TO_VIDEO.name());
        JsonNode imageOpts = submission.getPayload().get("meta").get("generate_video").get("image_opts");
        assertThat(imageOpts).hasSize(1);
        assertThat(imageOpts.get(0).get("mode").asText()).isEqualTo("first_frame");
        assertThat(imageOpts.get(0).get("url").asText()).isEqualTo("https://cdn/ref-0.png");
        assertThat(submission.getPayload().get("meta").get("aspect_ratio").asText()).isEmpty();
    }

    @Test
    @DisplayName("build: multi-image keeps reference order and marks the task domain")
    void build_multiImageToVideo() {
        List<String> urls = List.of("https://cdn/0.png", "https://cdn/1.png", "https://cdn/2.png");

        VendorSubmission submission = builder.build(videoRequest(3), settings.model(TestFixtures.MULTI_VIDEO_MODEL), urls);

        assertThat(submission.getRoute()).isEqualTo(HaiyiRoute.MULTI_IMAGE_TO_VIDEO.name());
        assertThat(submission.getRoutingKey()).isEqualTo("53");
        JsonNode payload = submission.getPayload();
        assertThat(payload.get("task_domain_type").asInt()).isEqualTo(25);
        JsonNode imageOpts = payload.get("meta").get("generate_video").get("image_opts");
        assertThat(imageOpts.findValuesAsText("url")).containsExactlyElementsOf(urls);
    }

    @Test
    @DisplayName("build: text-to-img payload sizes by aspect ratio")
    void build_textToImage() {
        GenerationRequest request = GenerationRequest.builder()
                .modelKey(TestFixtures.IMAGE_MODEL).prompt("cat").outputKind(OutputKind.IMAGE_BATCH).aspectRatio("3:4").build();

        VendorSubmission submission = builder.build(request, settings.model(TestFixtures.IMAGE_MODEL), List.of());

        assertThat(submission.getRoute()).isEqualTo(HaiyiRoute.TEXT_TO_IMAGE.name());
        JsonNode meta = submission.getPayload().get("meta");
        assertThat(meta.get("width").asInt()).isEqualTo(1536);
        assertThat(meta.get("height").asInt()).isEqualTo(2048);
        assertThat(meta.get("n_iter").asInt()).isEqualTo(4);
        assertThat(meta.get("seed").asLong()).isEqualTo(1_700_000_000L);
    }

    @Test
    @DisplayName("build: apply payload binds image and prompt to the configured nodes")
    void build_apply() {
        GenerationRequest request = GenerationRequest.builder()
                .modelKey(TestFixtures.APP_MODEL).prompt("cat").outputKind(OutputKind.IMAGE_BATCH).reference(REFERENCE).build();

        VendorSubmission submission = builder.build(request, settings.model(TestFixtures.APP_MODEL),
                List.of("https://cdn/ref.png"));

        assertThat(submission.getRoute()).isEqualTo(HaiyiRoute.APPLY.name());
        JsonNode payload = submission.getPayload();
        assertThat(payload.get("apply_id").asText()).isEqualTo("apply-1");
        assertThat(payload.get("ver_no").asText()).isEqualTo("ver-7");
        JsonNode inputs = payload.get("inputs");
        assertThat(inputs).hasSize(2);
        assertThat(inputs.get(0).get("node_id").asText()).isEqualTo("2");
        assertThat(inputs.get(0).get("val").asText()).isEqualTo("https://cdn/ref.png");
        assertThat(inputs.get(1).get("field").asText()).isEqualTo("prompt");
        assertThat(inputs.get(1).get("val").asText()).isEqualTo("cat");
    }

    @Test
    @DisplayName("videoSize: unknown resolution or ratio falls back to 640x360")
    void videoSize_defaults() {
        assertThat(HaiyiRequestBuilder.videoSize("16:9", "1080p")).containsExactly(1920, 1080);
        assertThat(HaiyiRequestBuilder.videoSize("9:16", "540p")).containsExactly(360, 640);
        assertThat(HaiyiRequestBuilder.videoSize("1:1", "720p")).containsExactly(640, 360);
        assertThat(HaiyiRequestBuilder.imageSize("21:9")).containsExactly(1024, 1024);
    }

    @Test
    @DisplayName("validate: task model without model numbers is a configuration error")
    void validate_missingModelNumbers() {
        ModelProfile incomplete = ModelProfile.builder()
                .key("broken").output(OutputKind.SINGLE_VIDEO).flow(ModelProfile.SubmitFlow.TASK).modelNo("m").build();

        assertThatThrownBy(() -> builder.validate(incomplete))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("broken");
    }

    @Test
    @DisplayName("build: non text-only variant without uploaded URLs is rejected")
    void build_missingUrls() {
        assertThatThrownBy(() -> builder.build(videoRequest(1), settings.model(TestFixtures.VIDEO_MODEL), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static GenerationRequest videoRequest(int references) {
        var request = GenerationRequest.builder().modelKey(TestFixtures.VIDEO_MODEL).outputKind(OutputKind.SINGLE_VIDEO);
        for (int i = 0; i < references; i++) {
            request.reference(REFERENCE);
        }
        return request.build();
    }
}
