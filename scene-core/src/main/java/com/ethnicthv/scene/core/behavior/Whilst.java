package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Runs {@code secondary} alongside {@code primary} for exactly as long as
 * {@code primary} is enabled.
 */
public final class Whilst implements IBehavior {

    private final IBehavior primary;
    private final IBehavior secondary;

    public Whilst(IBehavior primary, IBehavior secondary) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
    }

    @Override
    public boolean enabled(Sprite sprite) {
        return primary.enabled(sprite);
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        primary.execute(deltaTime, sprite);
        secondary.execute(deltaTime, sprite);
    }

    @Override
    public boolean remove(Sprite sprite) {
        return false;
    }
}
