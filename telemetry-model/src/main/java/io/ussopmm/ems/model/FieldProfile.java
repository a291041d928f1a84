package io.ussopmm.ems.model;

/**
 * Physically plausible range of one reading field and the largest change allowed between two
 * consecutive readings of the same device.
 */
public record FieldProfile(String field, double min, double max, double maxStep) {

    public FieldProfile {
        if (min > max) {
            throw new IllegalArgumentException("min > max for field " + field);
        }
        if (maxStep <= 0) {
            throw new IllegalArgumentException("maxStep must be positive for field " + field);
        }
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public double midpoint() {
        return (min + max) / 2.0;
    }
}
