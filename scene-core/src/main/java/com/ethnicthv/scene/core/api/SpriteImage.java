package com.ethnicthv.scene.core.api;

import java.util.Objects;

/**
 * Host-owned image asset reference. The engine never loads pixels: it only needs the
 * key to hand back to the {@link ISurface} and the size to compute collision bounds.
 */
public record SpriteImage(String key, float width, float height) {

    public SpriteImage {
        Objects.requireNonNull(key, "key");
        if (width < 0f || height < 0f) {
            throw new IllegalArgumentException("Image size must be >= 0, got " + width + "x" + height);
        }
    }
}
