package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Lets the wrapped behavior execute at most {@code count} times, then reports disabled.
 */
public final class Exactly implements IBehavior {

    private final IBehavior behavior;
    private int remaining;

    public Exactly(int count, IBehavior behavior) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        this.remaining = count;
        this.behavior = Objects.requireNonNull(behavior, "behavior");
    }

    @Override
    public boolean enabled(Sprite sprite) {
        return remaining > 0;
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        remaining--;
        behavior.execute(deltaTime, sprite);
    }

    @Override
    public boolean remove(Sprite sprite) {
        return false;
    }

    public int remaining() {
        return remaining;
    }
}
