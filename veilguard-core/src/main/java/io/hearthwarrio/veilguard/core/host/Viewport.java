package io.hearthwarrio.veilguard.core.host;

/**
 * Visible area of the host document, in CSS pixels.
 */
public final class Viewport {

    private final double width;
    private final double height;

    public Viewport(double width, double height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("viewport size must not be negative: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return "Viewport{" + width + "x" + height + '}';
    }
}
