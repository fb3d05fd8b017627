package dev.devanks.mediagen.orchestrator;

import dev.devanks.mediagen.orchestrator.config.ModelProfile;
import dev.devanks.mediagen.orchestrator.config.OrchestratorProperties;
import dev.devanks.mediagen.orchestrator.config.OrchestratorSettings;
import dev.devanks.mediagen.orchestrator.model.OutputKind;
import org.springframework.context.support.ResourceBundleMessageSource;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Shared test data: a configuration with one Haiyi model per submit flow and one DashScope model per
 * input shape, PNG bytes and the message bundle.
 */
public final class TestFixtures {

    public static final String COOKIE = "deviceId=abc; T=token";
    public static final String VIDEO_MODEL = "video";
    public static final String MULTI_VIDEO_MODEL = "video-multi";
    public static final String IMAGE_MODEL = "image";
    public static final String APP_MODEL = "app";

    public static final String DASHSCOPE_API_KEY = "sk-test";
    public static final String T2V_MODEL = "wan-t2v";
    public static final String I2V_MODEL = "wan-i2v";
    public static final String KF2V_MODEL = "wan-kf2v";
    public static final String T2I_MODEL = "wan-t2i";

    private TestFixtures() {
    }

    public static OrchestratorProperties properties() {
        var properties = new OrchestratorProperties();
        properties.getHaiyi().setCookie(COOKIE);

        var video = new OrchestratorProperties.ModelProperties();
        video.setOutput(OutputKind.SINGLE_VIDEO);
        video.setModelNo("video-model-no");
        video.setModelVerNo("video-ver-no");
        video.setSs(52);
        properties.getHaiyi().getModels().put(VIDEO_MODEL, video);

        var multiVideo = new OrchestratorProperties.ModelProperties();
        multiVideo.setOutput(OutputKind.SINGLE_VIDEO);
        multiVideo.setModelNo("multi-model-no");
        multiVideo.setModelVerNo("multi-ver-no");
        multiVideo.setSs(53);
        multiVideo.setMultiReference(true);
        properties.getHaiyi().getModels().put(MULTI_VIDEO_MODEL, multiVideo);

        var image = new OrchestratorProperties.ModelProperties();
        image.setOutput(OutputKind.IMAGE_BATCH);
        image.setModelNo("image-model-no");
        image.setModelVerNo("image-ver-no");
        image.setSs(52);
        properties.getHaiyi().getModels().put(IMAGE_MODEL, image);

        var app = new OrchestratorProperties.ModelProperties();
        app.setOutput(OutputKind.IMAGE_BATCH);
        app.setFlow(ModelProfile.SubmitFlow.APPLY);
        app.setApplyId("apply-1");
        app.setVerNo("ver-7");
        app.setSs(52);
        app.setPromptNode(binding("4", "SeaArtNanoBanana", "prompt"));
        app.setImageNode(binding("2", "LoadImage", "image"));
        properties.getHaiyi().getModels().put(APP_MODEL, app);

        properties.getDashscope().setApiKey(DASHSCOPE_API_KEY);
        properties.getDashscope().getModels().put(T2V_MODEL,
                dashScopeModel(OutputKind.SINGLE_VIDEO, "wan2.2-t2v-plus", ModelProfile.VideoMode.TEXT_TO_VIDEO));
        properties.getDashscope().getModels().put(I2V_MODEL,
                dashScopeModel(OutputKind.SINGLE_VIDEO, "wan2.2-i2v-plus", ModelProfile.VideoMode.IMAGE_TO_VIDEO));
        properties.getDashscope().getModels().put(KF2V_MODEL,
                dashScopeModel(OutputKind.SINGLE_VIDEO, "wanx2.1-kf2v-plus", ModelProfile.VideoMode.KEYFRAME_TO_VIDEO));
        var textToImage = dashScopeModel(OutputKind.IMAGE_BATCH, "wanx2.2-t2i-turbo", ModelProfile.VideoMode.TEXT_TO_VIDEO);
        textToImage.setImageCount(2);
        properties.getDashscope().getModels().put(T2I_MODEL, textToImage);
        return properties;
    }

    public static OrchestratorProperties.DashScopeModelProperties dashScopeModel(OutputKind output, String model,
                                                                                 ModelProfile.VideoMode videoMode) {
        var properties = new OrchestratorProperties.DashScopeModelProperties();
        properties.setOutput(output);
        properties.setModel(model);
        properties.setVideoMode(videoMode);
        return properties;
    }

    public static OrchestratorSettings settings() {
        return OrchestratorSettings.from(properties());
    }

    public static OrchestratorProperties.NodeBinding binding(String nodeId, String nodeType, String field) {
        var binding = new OrchestratorProperties.NodeBinding();
        binding.setNodeId(nodeId);
        binding.setNodeType(nodeType);
        binding.setField(field);
        return binding;
    }

    public static ResourceBundleMessageSource messageSource() {
        var messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        messageSource.setFallbackToSystemLocale(false);
        return messageSource;
    }

    public static byte[] png(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = image.createGraphics();
        g2d.setColor(Color.ORANGE);
        g2d.fillRect(0, 0, width, height);
        g2d.dispose();
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
