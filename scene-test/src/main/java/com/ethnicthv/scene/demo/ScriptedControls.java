package com.ethnicthv.scene.demo;

import com.ethnicthv.scene.core.api.IControls;

/**
 * Replays a fixed input pattern: hold right for {@code period} frames, then left for
 * {@code period} frames, and so on. Call {@link #tick()} once per frame.
 */
public final class ScriptedControls implements IControls {

    private final int period;
    private long frame;

    public ScriptedControls(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.period = period;
    }

    public void tick() {
        frame++;
    }

    @Override
    public boolean left() {
        return (frame / period) % 2 == 1;
    }

    @Override
    public boolean right() {
        return (frame / period) % 2 == 0;
    }
}
