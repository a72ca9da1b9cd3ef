package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Mirrors the wrapped behavior and asks the owner to drop it as soon as the wrapped
 * behavior stops being enabled.
 */
public final class RemoveWhenFinished implements IBehavior {

    private final IBehavior behavior;

    public RemoveWhenFinished(IBehavior behavior) {
        this.behavior = Objects.requireNonNull(behavior, "behavior");
    }

    @Override
    public boolean enabled(Sprite sprite) {
        return behavior.enabled(sprite);
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        behavior.execute(deltaTime, sprite);
    }

    @Override
    public boolean remove(Sprite sprite) {
        return !behavior.enabled(sprite);
    }
}
