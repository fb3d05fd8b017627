package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.TestFixtures;
import dev.devanks.mediagen.orchestrator.codec.ImageIoMediaCodec;
import dev.devanks.mediagen.orchestrator.codec.MediaCodec;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.exception.MediaCodecException;
import dev.devanks.mediagen.orchestrator.model.ErrorInfo;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.GenerationResult;
import dev.devanks.mediagen.orchestrator.model.ImageFrame;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.VideoClip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("FallbackProvider Unit Tests")
class FallbackProviderTest {

    private OrchestratorSettings settings;
    private FallbackProvider fallbackProvider;

    @BeforeEach
    void setUp() {
        settings = TestFixtures.settings();
        fallbackProvider = new FallbackProvider(new ImageIoMediaCodec(), new DiagnosticMessages(TestFixtures.messageSource()));
    }

    @Test
    @DisplayName("fallback: image output is one blank frame of the configured size")
    void fallback_imageShape() {
        GenerationResult result = fallbackProvider.fallback(OutputKind.IMAGE_BATCH,
                ErrorInfo.of(FailureCategory.SUBMISSION_ERROR, "HTTP 500"), null, settings);

        assertThat(result.isUsedFallback()).isTrue();
        assertThat(result.getOutputKind()).isEqualTo(OutputKind.IMAGE_BATCH);
        assertThat(result.getAssets()).singleElement().isInstanceOfSatisfying(ImageFrame.class, frame -> {
            assertThat(frame.getWidth()).isEqualTo(settings.getPlaceholderWidth());
            assertThat(frame.getHeight()).isEqualTo(settings.getPlaceholderHeight());
        });
        assertThat(result.getInfoText()).isEqualTo("Submission failed: HTTP 500");
        assertThat(result.getFailureCategory()).isEqualTo(FailureCategory.SUBMISSION_ERROR);
    }

    @Test
    @DisplayName("fallback: video output is one empty clip")
    void fallback_videoShape() {
        GenerationResult result = fallbackProvider.fallback(OutputKind.SINGLE_VIDEO,
                ErrorInfo.of(FailureCategory.POLL_TIMEOUT, "no terminal status after 300s"), "t-9", settings);

        assertThat(result.getAssets()).singleElement()
                .isInstanceOfSatisfying(VideoClip.class, clip -> assertThat(clip.isEmpty()).isTrue());
        assertThat(result.getTaskId()).isEqualTo("t-9");
        assertThat(result.getInfoText()).contains("t-9").contains("300s");
    }

    @ParameterizedTest
    @EnumSource(FailureCategory.class)
    @DisplayName("fallback: every category produces a non-empty message")
    void fallback_everyCategory(FailureCategory category) {
        GenerationResult result = fallbackProvider.fallback(OutputKind.IMAGE_BATCH,
                ErrorInfo.of(category, null), "t-1", settings);

        assertThat(result.getInfoText()).isNotBlank().doesNotContain("{0}").doesNotContain("{1}");
        assertThat(result.getFailureCategory()).isEqualTo(category);
    }

    @Test
    @DisplayName("fallback: categories are told apart in the message")
    void fallback_distinctMessages() {
        Set<String> messages = Arrays.stream(FailureCategory.values())
                .map(category -> fallbackProvider.fallback(OutputKind.IMAGE_BATCH, ErrorInfo.of(category, "x"), "t-1", settings)
                        .getInfoText())
                .collect(Collectors.toSet());

        assertThat(messages).hasSize(FailureCategory.values().length);
    }

    @Test
    @DisplayName("fallback: upload failures name the reference index")
    void fallback_uploadIndex() {
        ErrorInfo error = ErrorInfo.builder().category(FailureCategory.UPLOAD_ERROR).detail("HTTP 403").assetIndex(2).build();

        GenerationResult result = fallbackProvider.fallback(OutputKind.SINGLE_VIDEO, error, null, settings);

        assertThat(result.getInfoText()).isEqualTo("Upload failed: reference image 2 could not be uploaded. HTTP 403");
    }

    @Test
    @DisplayName("fallback: configured locale selects the translated bundle")
    void fallback_chineseLocale() {
        OrchestratorSettings chinese = settings.toBuilder().locale(Locale.SIMPLIFIED_CHINESE).build();

        GenerationResult result = fallbackProvider.fallback(OutputKind.IMAGE_BATCH,
                ErrorInfo.of(FailureCategory.CONTENT_POLICY_REJECTION, ""), "t-1", chinese);

        assertThat(result.getInfoText()).isEqualTo("系统拒绝，可能您的输入参数包含敏感内容，请修改后再试。");
    }

    @Test
    @DisplayName("fallback: missing error info defaults to an upstream failure")
    void fallback_nullError() {
        GenerationResult result = fallbackProvider.fallback(OutputKind.IMAGE_BATCH, null, "t-1", settings);

        assertThat(result.getFailureCategory()).isEqualTo(FailureCategory.UPSTREAM_FAILURE);
        assertThat(result.getInfoText()).isEqualTo("Generation failed on the service side (task t-1).");
    }

    @Test
    @DisplayName("fallback: a broken codec still yields a type-correct placeholder")
    void fallback_codecFailure() {
        MediaCodec brokenCodec = mock(MediaCodec.class);
        when(brokenCodec.placeholder(any(), anyInt(), anyInt())).thenThrow(new MediaCodecException("headless"));
        FallbackProvider provider = new FallbackProvider(brokenCodec, new DiagnosticMessages(TestFixtures.messageSource()));

        GenerationResult result = provider.fallback(OutputKind.IMAGE_BATCH, null, null, settings);

        assertThat(result.getAssets()).singleElement().isInstanceOf(ImageFrame.class);
    }
}
