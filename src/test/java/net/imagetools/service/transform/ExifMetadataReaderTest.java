package net.imagetools.service.transform;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Map;
import net.imagetools.testutil.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ExifMetadataReaderTest {

    private final ExifMetadataReader reader = new ExifMetadataReader();

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 6, 8})
    void should_ReadOrientationTag_When_JpegCarriesExif(int orientation) {
        byte[] jpeg = TestImages.withExifOrientation(TestImages.jpeg(8, 8, Color.RED), orientation);

        assertThat(reader.orientation(jpeg)).isEqualTo(orientation);
    }

    @Test
    void should_TreatImageAsUpright_When_MetadataIsMissingOrUnreadable() {
        assertThat(reader.orientation(TestImages.png(4, 4, Color.RED))).isEqualTo(ExifMetadataReader.ORIENTATION_NORMAL);
        assertThat(reader.orientation("not an image".getBytes())).isEqualTo(ExifMetadataReader.ORIENTATION_NORMAL);
        assertThat(reader.orientation(new byte[0])).isEqualTo(ExifMetadataReader.ORIENTATION_NORMAL);
    }

    @Test
    void should_DescribeOrientation_When_Summarizing() {
        byte[] jpeg = TestImages.withExifOrientation(TestImages.jpeg(8, 8, Color.RED), 6);

        Map<String, String> summary = reader.summarize(jpeg);

        assertThat(summary).containsKey("Orientation");
        assertThat(summary.get("Orientation")).contains("Rotate 90 CW");
    }

    @Test
    void should_ReturnEmptySummary_When_ImageHasNoExif() {
        assertThat(reader.summarize(TestImages.png(4, 4, Color.RED))).isEmpty();
        assertThat(reader.summarize("junk".getBytes())).isEmpty();
    }

    @Test
    void should_MirrorAndTranspose_When_ApplyingEveryOrientation() {
        BufferedImage source = new BufferedImage(3, 2, BufferedImage.TYPE_INT_ARGB);
        int marker = Color.RED.getRGB();
        source.setRGB(0, 0, marker);

        assertThat(ImageCodec.applyExifOrientation(source, 1)).isSameAs(source);
        assertThat(ImageCodec.applyExifOrientation(source, 2).getRGB(2, 0)).isEqualTo(marker);
        assertThat(ImageCodec.applyExifOrientation(source, 3).getRGB(2, 1)).isEqualTo(marker);
        assertThat(ImageCodec.applyExifOrientation(source, 4).getRGB(0, 1)).isEqualTo(marker);
        BufferedImage transposed = ImageCodec.applyExifOrientation(source, 5);
        assertThat(transposed.getWidth()).isEqualTo(2);
        assertThat(transposed.getRGB(0, 0)).isEqualTo(marker);
        assertThat(ImageCodec.applyExifOrientation(source, 6).getRGB(1, 0)).isEqualTo(marker);
        assertThat(ImageCodec.applyExifOrientation(source, 7).getRGB(1, 2)).isEqualTo(marker);
        assertThat(ImageCodec.applyExifOrientation(source, 8).getRGB(0, 2)).isEqualTo(marker);
    }
}
