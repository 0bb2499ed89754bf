package net.imagetools.domain.operation;

import java.util.List;
import java.util.Map;
import net.imagetools.exception.ValidationException;

/**
 * Primitive step produced by the AI collaborator. Ranges follow the vocabulary the
 * assistant is prompted with; anything outside them is a malformed plan.
 */
public sealed interface AiEditStep {

    /** Wire name used in the assistant's JSON block. */
    String type();

    Map<String, Object> parameters();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R brightness(Brightness step);

        R contrast(Contrast step);

        R saturation(Saturation step);

        R rotate(Rotate step);

        R crop(Crop step);

        R resize(Resize step);

        R blur(Blur step);

        R sharpen(Sharpen step);

        R sepia(Sepia step);

        R grayscale(Grayscale step);
    }

    record Brightness(double value) implements AiEditStep {
        public Brightness {
            requireRange("value", value, 0.5, 2.0);
        }

        public String type() {
            return "brightness";
        }

        public Map<String, Object> parameters() {
            return Map.of("value", value);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.brightness(this);
        }
    }

    record Contrast(double value) implements AiEditStep {
        public Contrast {
            requireRange("value", value, 0.5, 2.0);
        }

        public String type() {
            return "contrast";
        }

        public Map<String, Object> parameters() {
            return Map.of("value", value);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.contrast(this);
        }
    }

    record Saturation(double value) implements AiEditStep {
        public Saturation {
            requireRange("value", value, 0.0, 2.0);
        }

        public String type() {
            return "saturation";
        }

        public Map<String, Object> parameters() {
            return Map.of("value", value);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.saturation(this);
        }
    }

    /** Free rotation; unlike {@link RotateOperation} any angle is allowed and the canvas expands. */
    record Rotate(double degrees) implements AiEditStep {
        public Rotate {
            requireRange("degrees", degrees, -360.0, 360.0);
        }

        public String type() {
            return "rotate";
        }

        public Map<String, Object> parameters() {
            return Map.of("degrees", degrees);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.rotate(this);
        }
    }

    /** Crop box in source pixels, {@code [x1, y1, x2, y2)}. Clipped to the image at render time. */
    record Crop(int x1, int y1, int x2, int y2) implements AiEditStep {
        public Crop {
            if (x1 < 0 || y1 < 0) {
                throw new ValidationException("box", "Crop box origin must not be negative");
            }
            if (x2 <= x1 || y2 <= y1) {
                throw new ValidationException("box", "Crop box must have positive width and height");
            }
        }

        public String type() {
            return "crop";
        }

        public Map<String, Object> parameters() {
            return Map.of("box", List.of(x1, y1, x2, y2));
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.crop(this);
        }
    }

    record Resize(int width, int height) implements AiEditStep {
        public Resize {
            if (width <= 0 || height <= 0) {
                throw new ValidationException("width", "Resize step dimensions must be greater than 0");
            }
        }

        public String type() {
            return "resize";
        }

        public Map<String, Object> parameters() {
            return Map.of("width", width, "height", height);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.resize(this);
        }
    }

    record Blur(int radius) implements AiEditStep {
        public Blur {
            requireRange("radius", radius, 1, 10);
        }

        public String type() {
            return "blur";
        }

        public Map<String, Object> parameters() {
            return Map.of("radius", radius);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.blur(this);
        }
    }

    record Sharpen(double factor) implements AiEditStep {
        public Sharpen {
            requireRange("factor", factor, 0.5, 2.0);
        }

        public String type() {
            return "sharpen";
        }

        public Map<String, Object> parameters() {
            return Map.of("factor", factor);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.sharpen(this);
        }
    }

    record Sepia() implements AiEditStep {
        public String type() {
            return "sepia";
        }

        public Map<String, Object> parameters() {
            return Map.of();
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.sepia(this);
        }
    }

    record Grayscale() implements AiEditStep {
        public String type() {
            return "grayscale";
        }

        public Map<String, Object> parameters() {
            return Map.of();
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.grayscale(this);
        }
    }

    private static void requireRange(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw new ValidationException(field, field + " must be within [" + min + ", " + max + "] but was " + value);
        }
    }
}
