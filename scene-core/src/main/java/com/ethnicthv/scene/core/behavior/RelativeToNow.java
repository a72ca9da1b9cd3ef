package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Lets the wrapped behavior work in coordinates relative to where the sprite was when
 * this behavior first executed: the captured origin is added to whatever position the
 * wrapped behavior produces.
 */
public final class RelativeToNow implements IBehavior {

    private final IBehavior behavior;
    private Vector2 origin;

    public RelativeToNow(IBehavior behavior) {
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

        behavior.execute(deltaTime, sprite);
        sprite.setPosition(origin.plus(sprite.getPosition()));
    }

    @Override
    public boolean remove(Sprite sprite) {
        return false;
    }
}
