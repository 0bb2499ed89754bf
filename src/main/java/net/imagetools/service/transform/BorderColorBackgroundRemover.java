package net.imagetools.service.transform;

import java.awt.image.BufferedImage;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-process background remover that keys out the colour found along the image border.
 *
 * <p>The border is sampled to estimate the background colour, then a flood fill from every
 * edge pixel clears connected pixels within the model's colour tolerance. Foreground that
 * does not touch the border is never cleared. Model ids map to tolerances, so the same
 * catalogue names work whether this or an external segmentation service is wired in.</p>
 */
@Slf4j
@Component
public class BorderColorBackgroundRemover implements BackgroundRemover {

    private static final int DEFAULT_TOLERANCE = 48;

    private static final Map<String, Integer> MODEL_TOLERANCES = Map.of(
        "u2net", 48,
        "u2net_human_seg", 40,
        "isnet-general-use", 56,
        "isnet-anime", 64
    );

    @Override
    public BufferedImage removeBackground(BufferedImage source, String modelId) {
        BufferedImage argb = ImageCodec.toArgb(source);
        int width = argb.getWidth();
        int height = argb.getHeight();
        int[] pixels = argb.getRGB(0, 0, width, height, null, 0, width);
        int background = averageBorderColor(pixels, width, height);
        int tolerance = MODEL_TOLERANCES.getOrDefault(modelId, DEFAULT_TOLERANCE);

        boolean[] visited = new boolean[pixels.length];
        int[] queue = new int[pixels.length];
        int head = 0;
        int tail = 0;
        for (int x = 0; x < width; x++) {
            tail = enqueue(queue, tail, visited, x);
            tail = enqueue(queue, tail, visited, (height - 1) * width + x);
        }
        for (int y = 0; y < height; y++) {
            tail = enqueue(queue, tail, visited, y * width);
            tail = enqueue(queue, tail, visited, y * width + width - 1);
        }

        int cleared = 0;
        while (head < tail) {
            int index = queue[head++];
            if (distance(pixels[index], background) > tolerance) {
                continue;
            }
            pixels[index] = pixels[index] & 0x00FFFFFF;
            cleared++;
            int x = index % width;
            int y = index / width;
            if (x > 0) {
                tail = enqueue(queue, tail, visited, index - 1);
            }
            if (x < width - 1) {
                tail = enqueue(queue, tail, visited, index + 1);
            }
            if (y > 0) {
                tail = enqueue(queue, tail, visited, index - width);
            }
            if (y < height - 1) {
                tail = enqueue(queue, tail, visited, index + width);
            }
        }

        log.debug("Background removal with model {} cleared {} of {} pixels", modelId, cleared, pixels.length);
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        result.setRGB(0, 0, width, height, pixels, 0, width);
        return result;
    }

    private static int enqueue(int[] queue, int tail, boolean[] visited, int index) {
        if (visited[index]) {
            return tail;
        }
        visited[index] = true;
        queue[tail] = index;
        return tail + 1;
    }

    private static int averageBorderColor(int[] pixels, int width, int height) {
        long r = 0;
        long g = 0;
        long b = 0;
        long count = 0;
        for (int x = 0; x < width; x++) {
            for (int y : new int[] {0, height - 1}) {
                int argb = pixels[y * width + x];
                r += (argb >> 16) & 0xFF;
                g += (argb >> 8) & 0xFF;
                b += argb & 0xFF;
                count++;
            }
        }
        for (int y = 1; y < height - 1; y++) {
            for (int x : new int[] {0, width - 1}) {
                int argb = pixels[y * width + x];
                r += (argb >> 16) & 0xFF;
                g += (argb >> 8) & 0xFF;
                b += argb & 0xFF;
                count++;
            }
        }
        return (int) (r / count) << 16 | (int) (g / count) << 8 | (int) (b / count);
    }

    private static int distance(int argb, int rgb) {
        int dr = Math.abs(((argb >> 16) & 0xFF) - ((rgb >> 16) & 0xFF));
        int dg = Math.abs(((argb >> 8) & 0xFF) - ((rgb >> 8) & 0xFF));
        int db = Math.abs((argb & 0xFF) - (rgb & 0xFF));
        return Math.max(dr, Math.max(dg, db));
    }
}
