package dev.kappalib.service;

import dev.kappalib.exception.UnsupportedImageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvatarImageProcessorTest {

    private AvatarImageProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new AvatarImageProcessor();
    }

    private static byte[] image(int width, int height, String format, int type) throws IOException {
        BufferedImage img = new BufferedImage(width, height, type);
        Graphics2D g = img.createGraphics();
        g.setColor(Color.BLUE);
        g.fillRect(0, 0, width, height);
        // Centre square is red so the crop is observable
        g.setColor(Color.RED);
        int side = Math.min(width, height);
        g.fillRect((width - side) / 2, (height - side) / 2, side, side);
        g.dispose();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, format, out);
        return out.toByteArray();
    }

    private static BufferedImage read(byte[] data) throws IOException {
        return ImageIO.read(new ByteArrayInputStream(data));
    }

    @Test
    @DisplayName("Wide PNG should be centre-cropped and resized to a 250x250 JPEG")
    void shouldCropWideImage() throws IOException {
        byte[] result = processor.process(image(3000, 1000, "png", BufferedImage.TYPE_INT_RGB));

        BufferedImage avatar = read(result);
        assertThat(avatar.getWidth()).isEqualTo(250);
        assertThat(avatar.getHeight()).isEqualTo(250);
        assertThat(result[0] & 0xFF).isEqualTo(0xFF);
        assertThat(result[1] & 0xFF).isEqualTo(0xD8);

        Color corner = new Color(avatar.getRGB(5, 5));
        assertThat(corner.getRed()).isGreaterThan(200);
        assertThat(corner.getBlue()).isLessThan(60);
    }

    @Test
    @DisplayName("JPEG input should be accepted")
    void shouldAcceptJpeg() throws IOException {
        byte[] result = processor.process(image(400, 600, "jpg", BufferedImage.TYPE_INT_RGB));

        assertThat(read(result).getWidth()).isEqualTo(AvatarImageProcessor.AVATAR_SIZE);
    }

    @Test
    @DisplayName("Transparent PNG areas should become white")
    void shouldFlattenTransparency() throws IOException {
        BufferedImage img = new BufferedImage(100, 100, BufferedImage.TYPE_INT_ARGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);

        BufferedImage avatar = read(processor.process(out.toByteArray()));

        Color pixel = new Color(avatar.getRGB(125, 125));
        assertThat(pixel.getRed()).isGreaterThan(240);
        assertThat(pixel.getGreen()).isGreaterThan(240);
        assertThat(pixel.getBlue()).isGreaterThan(240);
    }

    @Test
    @DisplayName("GIF should be rejected")
    void shouldRejectGif() throws IOException {
        byte[] gif = image(50, 50, "gif", BufferedImage.TYPE_INT_RGB);

        assertThatThrownBy(() -> processor.process(gif))
                .isInstanceOf(UnsupportedImageException.class);
    }

    @Test
    @DisplayName("Non-image bytes should be rejected")
    void shouldRejectGarbage() {
        byte[] garbage = "definitely not an image".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> processor.process(garbage))
                .isInstanceOf(UnsupportedImageException.class);
    }
}
