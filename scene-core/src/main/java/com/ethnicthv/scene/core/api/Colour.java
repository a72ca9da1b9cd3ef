package com.ethnicthv.scene.core.api;

/**
 * 8-bit RGB colour handed to the host surface.
 */
public record Colour(int red, int green, int blue) {

    public static final Colour BLACK = new Colour(0, 0, 0);
    public static final Colour WHITE = new Colour(255, 255, 255);
    public static final Colour RED = new Colour(255, 0, 0);
    public static final Colour CYAN = new Colour(0, 255, 255);
    public static final Colour YELLOW = new Colour(255, 255, 0);

    public Colour {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be in [0, 255], got " + value);
        }
    }
}
