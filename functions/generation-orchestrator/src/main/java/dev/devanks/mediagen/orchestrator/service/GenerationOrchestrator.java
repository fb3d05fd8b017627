package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.backend.VendorRegistry;
import dev.devanks.mediagen.orchestrator.builder.RequestBuilder;
import dev.devanks.mediagen.orchestrator.config.ModelProfile;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.config.SettingsStore;
import dev.devanks.mediagen.orchestrator.exception.AssetUploadException;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.exception.GenerationException;
import dev.devanks.mediagen.orchestrator.model.Asset;
import dev.devanks.mediagen.orchestrator.model.ErrorInfo;
import dev.devanks.mediagen.orchestrator.model.FailureCategory;
import dev.devanks.mediagen.orchestrator.model.GenerationRequest;
import dev.devanks.mediagen.orchestrator.model.GenerationResult;
import dev.devanks.mediagen.orchestrator.model.MediaPayload;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.PollOutcome;
import dev.devanks.mediagen.orchestrator.model.QuotaSnapshot;
import dev.devanks.mediagen.orchestrator.model.SourceAsset;
import dev.devanks.mediagen.orchestrator.model.SubmissionOutcome;
import dev.devanks.mediagen.orchestrator.model.SubmissionVariant;
import dev.devanks.mediagen.orchestrator.model.Task;
import dev.devanks.mediagen.orchestrator.model.TaskStatus;
import dev.devanks.mediagen.orchestrator.model.VendorSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs one generation end to end: upload, submit, poll, collect, probe quota.
 * <p>
 * Configuration and request-shape problems are checked up front and escape as exceptions before any
 * network call. From the first upload on, the invocation works on one settings snapshot and every
 * failure, a late {@link ConfigurationException} included, becomes a placeholder from {@link FallbackProvider}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationOrchestrator {

    private final SettingsStore settingsStore;
    private final VendorRegistry vendorRegistry;
    private final AssetUploader assetUploader;
    private final TaskSubmitter taskSubmitter;
    private final TaskPoller taskPoller;
    private final ResultCollector resultCollector;
    private final QuotaProber quotaProber;
    private final FallbackProvider fallbackProvider;
    private final DiagnosticMessages diagnosticMessages;
    private final Clock clock;

    public GenerationResult generate(GenerationRequest request) {
        OrchestratorSettings settings = settingsStore.current();
        ModelProfile model = settings.model(request.getModelKey());
        RequestBuilder requestBuilder = vendorRegistry.builder(model.getVendor());
        checkConfiguration(request, model, requestBuilder, settings);
        SubmissionVariant variant = requestBuilder.variantFor(request, model);
        BackendSession session = vendorRegistry.session(model.getVendor(), settings);

        Instant start = clock.instant();
        Task task = new Task(start);
        OutputKind outputKind = request.getOutputKind();
        FailureCategory stage = FailureCategory.UPLOAD_ERROR;
        log.info("Starting {} {} generation with model {}.", model.getVendor(), outputKind, model.getKey());

        try {
            List<Asset> references = assetUploader.uploadAll(session, referencesFor(variant, request),
                    model.uploadScope(), settings.getMaxAssetsPerTask());

            stage = FailureCategory.SUBMISSION_ERROR;
            List<String> referenceUrls = references.stream().map(Asset::getRemoteUrl).toList();
            VendorSubmission submission = requestBuilder.build(request, model, referenceUrls);
            SubmissionOutcome submitted = taskSubmitter.submit(session, task, submission);
            if (!submitted.isAccepted()) {
                return fallbackProvider.fallback(outputKind, submitted.getError(), null, settings);
            }

            stage = FailureCategory.UPSTREAM_FAILURE;
            PollOutcome polled = taskPoller.await(session, task, settings.getPollInterval(), settings.getMaxWait());
            if (polled.getStatus() != TaskStatus.SUCCEEDED) {
                return fallbackProvider.fallback(outputKind, task.getErrorInfo(), task.getId(), settings);
            }

            stage = FailureCategory.RESULT_ASSEMBLY_ERROR;
            List<MediaPayload> media = resultCollector.collect(session, task, outputKind, polled.getResultUrls(),
                    settings.getMaxAssetsPerTask());

            List<String> infoLines = infoLines(request, model, task, settings.getLocale());
            QuotaSnapshot quota = quotaProber.probe(session);
            if (quota.isOk()) {
                infoLines.add(diagnosticMessages.text("info.balance", "Remaining credits: {0}", settings.getLocale(),
                        String.valueOf(quota.getBalance())));
            }

            log.info("Generation of task {} finished in {} ms with {} asset(s).", task.getId(),
                    ChronoUnit.MILLIS.between(start, clock.instant()), media.size());
            return GenerationResult.builder()
                    .outputKind(outputKind)
                    .assets(media)
                    .infoText(String.join("\n", infoLines))
                    .usedFallback(false)
                    .taskId(task.getId())
                    .remoteUrls(task.getAssets().stream().map(Asset::getRemoteUrl).toList())
                    .build();

        } catch (AssetUploadException e) {
            return fallbackProvider.fallback(outputKind, ErrorInfo.builder()
                    .category(FailureCategory.UPLOAD_ERROR)
                    .detail(e.getMessage())
                    .assetIndex(e.getAssetIndex())
                    .build(), null, settings);
        } catch (GenerationException e) {
            log.error("Generation failed ({}): {}", e.getCategory(), e.getMessage(), e);
            return fallbackProvider.fallback(outputKind, ErrorInfo.of(e.getCategory(), e.getMessage()), task.getId(), settings);
        } catch (RuntimeException e) {
            log.error("Generation failed unexpectedly during {}: {}", stage, e.getMessage(), e);
            return fallbackProvider.fallback(outputKind, ErrorInfo.of(stage, e.getMessage()), task.getId(), settings);
        }
    }

    private static void checkConfiguration(GenerationRequest request, ModelProfile model, RequestBuilder requestBuilder,
                                           OrchestratorSettings settings) {
        settings.requireCredentials(model.getVendor());
        if (model.getOutput() != request.getOutputKind()) {
            throw new ConfigurationException("Model " + model.getKey() + " produces " + model.getOutput()
                    + " but " + request.getOutputKind() + " was requested");
        }
        requestBuilder.validate(model);
    }

    private static List<SourceAsset> referencesFor(SubmissionVariant variant, GenerationRequest request) {
        return switch (variant) {
            case TEXT_ONLY -> List.of();
            case SINGLE_IMAGE -> request.getReferences().subList(0, 1);
            case MULTI_IMAGE -> request.getReferences();
        };
    }

    private List<String> infoLines(GenerationRequest request, ModelProfile model, Task task, Locale locale) {
        List<String> lines = new ArrayList<>();
        lines.add(diagnosticMessages.text("info.model", "Model: {0}", locale, model.getKey()));
        if (request.getOutputKind() == OutputKind.SINGLE_VIDEO) {
            lines.add(diagnosticMessages.text("info.duration", "Duration: {0}s", locale, String.valueOf(request.getDurationSeconds())));
            lines.add(diagnosticMessages.text("info.quality", "Quality: {0}", locale, request.getResolution()));
            lines.add(diagnosticMessages.text("info.aspect-ratio", "Aspect ratio: {0}", locale, request.getAspectRatio()));
            lines.add(diagnosticMessages.text("info.task-id", "Task ID: {0}", locale, task.getId()));
            lines.add(diagnosticMessages.text("info.video-link", "Video link:", locale));
            task.getAssets().forEach(asset -> lines.add(asset.getRemoteUrl()));
        } else {
            lines.add(diagnosticMessages.text("info.aspect-ratio", "Aspect ratio: {0}", locale, request.getAspectRatio()));
            lines.add(diagnosticMessages.text("info.resolution", "Resolution: {0}", locale, request.getResolution()));
            lines.add(diagnosticMessages.text("info.task-id", "Task ID: {0}", locale, task.getId()));
            lines.add(diagnosticMessages.text("info.image-links", "Image links:", locale));
            task.getAssets().forEach(asset -> lines.add("[" + asset.getIndex() + "] " + asset.getRemoteUrl()));
        }
        return lines;
    }
}
