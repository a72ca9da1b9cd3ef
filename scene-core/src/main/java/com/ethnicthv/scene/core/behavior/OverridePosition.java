package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Runs the wrapped behavior against a private position slot.
 * <p>
 * Each tick the sprite's current position becomes its normal position (the anchor
 * another behavior, e.g. a formation movement, has just set), the slot is swapped into
 * the sprite's position, the wrapped behavior runs, and the result is stored back in the
 * slot. Combined with {@link ReturnToNormalPosition} this lets a sprite break away from
 * an anchor that keeps moving and later fly back to it.
 */
public final class OverridePosition implements IBehavior {

    private final IBehavior behavior;
    private Vector2 position;

    public OverridePosition(IBehavior behavior) {
        this.behavior = Objects.requireNonNull(behavior, "behavior");
    }

    @Override
    public boolean enabled(Sprite sprite) {
        return behavior.enabled(sprite);
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        if (position == null) {
            position = sprite.getPosition();
        }

        sprite.setNormalPosition(sprite.getPosition());
        sprite.setPosition(position);
        behavior.execute(deltaTime, sprite);
        position = sprite.getPosition();
    }

    @Override
    public boolean remove(Sprite sprite) {
        return false;
    }
}
