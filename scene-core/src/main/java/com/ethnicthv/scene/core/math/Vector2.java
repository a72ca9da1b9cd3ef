package com.ethnicthv.scene.core.math;

/**
 * Immutable 2D vector in screen space (x grows right, y grows down).
 */
public record Vector2(float x, float y) {

    public static final Vector2 ZERO = new Vector2(0f, 0f);

    public static Vector2 of(float x, float y) {
        return new Vector2(x, y);
    }

    public Vector2 plus(Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    public Vector2 plus(float dx, float dy) {
        return new Vector2(x + dx, y + dy);
    }

    public Vector2 withX(float newX) {
        return new Vector2(newX, y);
    }

    public Vector2 withY(float newY) {
        return new Vector2(x, newY);
    }
}
