package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Like {@link RelativeToNow} but only the x axis is rebased on the captured origin.
 * Any change the wrapped behavior makes to y is discarded.
 */
public final class RelativeToNowOnlyX implements IBehavior {

    private final IBehavior behavior;
    private Vector2 origin;

    public RelativeToNowOnlyX(IBehavior behavior) {
        this.behavior = Objects.requireNonNull(behavior, "behavior");
    }

    @Override
    public boolean enabled(Sprite sprite) {
        return behavior.enabled(sprite);
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        if (origin == null) {
            origin = sprite.getPosition();
        }

        float y = sprite.getPosition().y();
        behavior.execute(deltaTime, sprite);
        sprite.setPosition(origin.x() + sprite.getPosition().x(), y);
    }

    @Override
    public boolean remove(Sprite sprite) {
        return false;
    }
}
