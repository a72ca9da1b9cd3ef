package com.ethnicthv.scene.core.math;

/**
 * Axis-aligned rectangle anchored at its top-left corner.
 */
public record Rect(float x, float y, float width, float height) {

    public Rect {
        if (width < 0f || height < 0f) {
            throw new IllegalArgumentException("Rect size must be >= 0, got " + width + "x" + height);
        }
    }

    /**
     * Rectangle of the given size centred on {@code centre}.
     */
    public static Rect centredOn(Vector2 centre, float width, float height) {
        return new Rect(centre.x() - width / 2f, centre.y() - height / 2f, width, height);
    }

    public float right() {
        return x + width;
    }

    public float bottom() {
        return y + height;
    }

    /**
     * True when the intersection has a strictly positive area. Rectangles that only
     * share an edge do not intersect.
     */
    public boolean intersects(Rect other) {
        return x < other.right() && other.x < right()
                && y < other.bottom() && other.y < bottom();
    }
}
