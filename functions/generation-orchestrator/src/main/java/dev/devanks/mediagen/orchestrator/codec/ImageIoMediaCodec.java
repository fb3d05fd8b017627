package dev.devanks.mediagen.orchestrator.codec;

import dev.devanks.mediagen.orchestrator.exception.MediaCodecException;
import dev.devanks.mediagen.orchestrator.model.ImageFrame;
import dev.devanks.mediagen.orchestrator.model.MediaPayload;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import dev.devanks.mediagen.orchestrator.model.VideoClip;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
@Slf4j
public class ImageIoMediaCodec implements MediaCodec {

    private static final String DEFAULT_CONTAINER = "mp4";
    private static final Set<String> KNOWN_CONTAINERS = Set.of("mp4", "webm", "mov", "mkv");

    @Override
    public byte[] toPng(byte[] imageBytes) {
        return encodePng(readImage(imageBytes));
    }

    @Override
    public ImageFrame decodeImage(byte[] bytes) {
        BufferedImage image = readImage(bytes);
        return new ImageFrame(toRgb(image));
    }

    @Override
    public List<ImageFrame> normalizeBatch(List<ImageFrame> frames) {
        if (frames.size() < 2) {
            return frames;
        }
        int width = frames.get(0).getWidth();
        int height = frames.get(0).getHeight();
        List<ImageFrame> normalized = new ArrayList<>(frames.size());
        for (int i = 0; i < frames.size(); i++) {
            ImageFrame frame = frames.get(i);
            if (frame.getWidth() == width && frame.getHeight() == height) {
                normalized.add(frame);
            } else {
                log.debug("Resizing frame {} from {}x{} to {}x{}.", i, frame.getWidth(), frame.getHeight(), width, height);
                normalized.add(new ImageFrame(resize(frame.getImage(), width, height)));
            }
        }
        return normalized;
    }

    @Override
    public VideoClip decodeVideo(byte[] bytes, String sourceUrl) {
        if (bytes == null || bytes.length == 0) {
            throw new MediaCodecException("Video " + sourceUrl + " has no content");
        }
        return new VideoClip(bytes, containerOf(sourceUrl), sourceUrl);
    }

    @Override
    public MediaPayload placeholder(OutputKind outputKind, int width, int height) {
        if (outputKind == OutputKind.SINGLE_VIDEO) {
            return VideoClip.empty(DEFAULT_CONTAINER);
        }
        // TYPE_INT_RGB starts all black
        return new ImageFrame(new BufferedImage(Math.max(1, width), Math.max(1, height), BufferedImage.TYPE_INT_RGB));
    }

    static String containerOf(String url) {
        if (url == null) {
            return DEFAULT_CONTAINER;
        }
        String path = url.toLowerCase(Locale.ROOT);
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return DEFAULT_CONTAINER;
        }
        String extension = path.substring(dot + 1);
        return KNOWN_CONTAINERS.contains(extension) ? extension : DEFAULT_CONTAINER;
    }

    private BufferedImage readImage(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MediaCodecException("Image bytes are empty");
        }
        try (ByteArrayInputStream in = new ByteArrayInputStream(bytes)) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new MediaCodecException("Unsupported or corrupt image format (" + bytes.length + " bytes)");
            }
            return image;
        } catch (IOException e) {
            throw new MediaCodecException("Could not read image: " + e.getMessage(), e);
        }
    }

    private byte[] encodePng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, "png", out)) {
                throw new MediaCodecException("No PNG ImageWriter available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new MediaCodecException("Could not encode PNG: " + e.getMessage(), e);
        }
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        return resize(image, image.getWidth(), image.getHeight());
    }

    private static BufferedImage resize(BufferedImage source, int width, int height) {
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = target.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.drawImage(source, 0, 0, width, height, null);
        } finally {
            g2d.dispose();
        }
        return target;
    }
}
