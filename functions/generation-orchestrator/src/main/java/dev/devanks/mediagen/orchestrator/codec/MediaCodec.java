package dev.devanks.mediagen.orchestrator.codec;

import dev.devanks.mediagen.orchestrator.exception.MediaCodecException;
import dev.devanks.mediagen.orchestrator.model.ImageFrame;
import dev.devanks.mediagen.orchestrator.model.MediaPayload;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.VideoClip;

import java.util.List;

/**
 * Conversion between raw bytes and the pipeline's media types.
 * Every decode/encode method throws {@link MediaCodecException} on unreadable input.
 */
public interface MediaCodec {

    /**
     * Re-encodes a caller supplied image (any format ImageIO reads) as PNG for upload.
     */
    byte[] toPng(byte[] imageBytes);

    ImageFrame decodeImage(byte[] bytes);

    /**
     * Scales every frame to the first frame's size so the batch has one shape.
     */
    List<ImageFrame> normalizeBatch(List<ImageFrame> frames);

    VideoClip decodeVideo(byte[] bytes, String sourceUrl);

    /**
     * Type-correct stand-in for a result that could not be produced. Never throws.
     */
    MediaPayload placeholder(OutputKind outputKind, int width, int height);
}
