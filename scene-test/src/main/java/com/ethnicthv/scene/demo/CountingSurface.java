package com.ethnicthv.scene.demo;

import com.ethnicthv.scene.core.api.Colour;
import com.ethnicthv.scene.core.api.ISurface;
import com.ethnicthv.scene.core.api.SpriteImage;
import com.ethnicthv.scene.core.math.Vector2;

/**
 * Headless surface: counts draw calls instead of rendering.
 */
public final class CountingSurface implements ISurface {

    private long fills;
    private long blits;
    private long circles;
    private long texts;

    @Override
    public void fill(Colour colour) {
        fills++;
    }

    @Override
    public void blit(SpriteImage image, Vector2 centre) {
        blits++;
    }

    @Override
    public void filledCircle(Vector2 centre, float radius, Colour colour) {
        circles++;
    }

    @Override
    public void text(String text, Vector2 centre, Colour colour, float fontSize) {
        texts++;
    }

    public long fills() {
        return fills;
    }

    public long blits() {
        return blits;
    }

    public long circles() {
        return circles;
    }

    public long texts() {
        return texts;
    }
}
