package dev.devanks.mediagen.orchestrator.service;

import dev.devanks.mediagen.orchestrator.backend.BackendSession;
import dev.devanks.mediagen.orchestrator.codec.MediaCodec;
import dev.devanks.mediagen.orchestrator.exception.AssetUploadException;
import dev.devanks.mediagen.orchestrator.exception.ConfigurationException;
import dev.devanks.mediagen.orchestrator.model.Asset;
import dev.devanks.mediagen.orchestrator.model.AssetKind;
import dev.devanks.mediagen.orchestrator.model.SourceAsset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Uploads reference images one after the other. The first failure aborts the stage; callers never
 * see a partial set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetUploader {

    private static final String PNG_CONTENT_TYPE = "image/png";

    private final MediaCodec mediaCodec;

    /**
     * @return uploaded assets with their remote URL, index i for input i
     * @throws AssetUploadException tagged with the index of the first asset that failed
     */
    public List<Asset> uploadAll(BackendSession session, List<SourceAsset> sources, String scope, int maxAssets) {
        if (sources.size() > maxAssets) {
            throw new AssetUploadException(maxAssets,
                    "Got " + sources.size() + " reference images, at most " + maxAssets + " are allowed");
        }

        List<Asset> uploaded = new ArrayList<>(sources.size());
        for (int index = 0; index < sources.size(); index++) {
            SourceAsset source = sources.get(index);
            String url = uploadOne(session, index, source, scope);
            log.info("Reference {} ({}) uploaded.", index, source.getSourceRef());
            uploaded.add(Asset.builder()
                    .index(index)
                    .kind(AssetKind.IMAGE)
                    .sourceRef(source.getSourceRef())
                    .remoteUrl(url)
                    .build());
        }
        return uploaded;
    }

    private String uploadOne(BackendSession session, int index, SourceAsset source, String scope) {
        try {
            byte[] png = mediaCodec.toPng(source.getBytes());
            return session.uploadAsset(png, "reference-" + index + ".png", PNG_CONTENT_TYPE, scope);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Upload of reference {} ({}) failed: {}", index, source.getSourceRef(), e.getMessage(), e);
            throw new AssetUploadException(index, e.getMessage(), e);
        }
    }
}
