package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.codec.MediaCodec;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.exception.ResultAssemblyException;
import dev.devanks.mediagen.orchestrator.model.Asset;
import dev.devanks.mediagen.orchestrator.model.AssetKind;
import dev.devanks.mediagen.orchestrator.model.ImageFrame;
import dev.devanks.mediagen.orchestrator.model.MediaPayload;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.Task;
import dev.devanks.mediagen.orchestrator.model.TaskStatus;
import dev.devanks.mediagen.orchestrator.model.VideoClip;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Downloads and decodes the outputs of a succeeded task. All or nothing: one bad download fails the stage
 * and no asset is attached to the task.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResultCollector {

    private final MediaCodec mediaCodec;

    public List<MediaPayload> collect(BackendSession session, Task task, OutputKind outputKind, List<String> resultUrls,
                                      int maxAssets) {
        if (task.getStatus() != TaskStatus.SUCCEEDED) {
            throw new IllegalStateException("Task " + task.getId() + " is " + task.getStatus() + ", nothing to collect");
        }
        if (resultUrls == null || resultUrls.isEmpty()) {
            throw new ResultAssemblyException("Task " + task.getId() + " succeeded without result links");
        }
        return outputKind == OutputKind.SINGLE_VIDEO
                ? collectVideo(session, task, resultUrls)
                : collectImages(session, task, resultUrls, maxAssets);
    }

    static String pickVideoUrl(List<String> urls) {
        return urls.stream()
                .filter(url -> url.toLowerCase(Locale.ROOT).endsWith(".mp4"))
                .findFirst()
                .orElse(urls.get(0));
    }

    private List<MediaPayload> collectVideo(BackendSession session, Task task, List<String> urls) {
        String url = pickVideoUrl(urls);
        log.info("Downloading video of task {} from {}.", task.getId(), url);
        byte[] bytes = download(session, 0, url);
        VideoClip clip = decode(0, url, () -> mediaCodec.decodeVideo(bytes, url));

        task.addAsset(Asset.builder().index(0).kind(AssetKind.VIDEO).sourceRef(url).remoteUrl(url).bytes(bytes).build());
        return List.of(clip);
    }

    private List<MediaPayload> collectImages(BackendSession session, Task task, List<String> urls, int maxAssets) {
        List<String> capped = urls.subList(0, Math.min(urls.size(), maxAssets));
        if (capped.size() < urls.size()) {
            log.info("Task {} returned {} images, keeping the first {}.", task.getId(), urls.size(), capped.size());
        }

        List<Asset> assets = new ArrayList<>(capped.size());
        List<ImageFrame> frames = new ArrayList<>(capped.size());
        for (int index = 0; index < capped.size(); index++) {
            String url = capped.get(index);
            byte[] bytes = download(session, index, url);
            frames.add(decode(index, url, () -> mediaCodec.decodeImage(bytes)));
            assets.add(Asset.builder().index(index).kind(AssetKind.IMAGE).sourceRef(url).remoteUrl(url).bytes(bytes).build());
        }

        List<ImageFrame> normalized = decode(0, capped.get(0), () -> mediaCodec.normalizeBatch(frames));
        assets.forEach(task::addAsset);
        log.info("Collected {} image(s) for task {}.", normalized.size(), task.getId());
        return new ArrayList<>(normalized);
    }

    private byte[] download(BackendSession session, int index, String url) {
        try {
            return session.download(url);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Download of result {} ({}) failed: {}", index, url, e.getMessage(), e);
            throw new ResultAssemblyException("Download of result " + index + " failed: " + e.getMessage(), e);
        }
    }

    private static <T> T decode(int index, String url, Supplier<T> decoder) {
        try {
            return decoder.get();
        } catch (RuntimeException e) {
            log.error("Result {} ({}) could not be decoded: {}", index, url, e.getMessage(), e);
            throw new ResultAssemblyException("Result " + index + " could not be decoded: " + e.getMessage(), e);
        }
    }
}
