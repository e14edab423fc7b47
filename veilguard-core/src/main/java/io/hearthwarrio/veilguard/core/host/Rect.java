package io.hearthwarrio.veilguard.core.host;

/**
 * Axis-aligned layout box relative to the viewport.
 */
public final class Rect {

    private final double left;
    private final double top;
    private final double width;
    private final double height;

    public Rect(double left, double top, double width, double height) {
        this.left = left;
        this.top = top;
        this.width = Math.max(0.0, width);
        this.height = Math.max(0.0, height);
    }

    public double getLeft() {
        return left;
    }

    public double getTop() {
        return top;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getRight() {
        return left + width;
    }

    public double getBottom() {
        return top + height;
    }

    /**
     * Touching edges count as an intersection.
     *
     * @param other other box
     * @return true if the boxes overlap or touch
     */
    public boolean intersects(Rect other) {
        if (other == null) {
            return false;
        }
        return !(getRight() < other.left
                || left > other.getRight()
                || getBottom() < other.top
                || top > other.getBottom());
    }

    /**
     * @param viewport viewport
     * @param fraction required share of both viewport width and height, {@code 0..1}
     * @return true if this box spans at least {@code fraction} of the viewport in both dimensions
     */
    public boolean coversAtLeast(Viewport viewport, double fraction) {
        if (viewport == null) {
            return false;
        }
        return width >= viewport.getWidth() * fraction && height >= viewport.getHeight() * fraction;
    }

    @Override
    public String toString() {
        return "Rect{" +
                "left=" + left +
                ", top=" + top +
                ", width=" + width +
                ", height=" + height +
                '}';
    }
}
