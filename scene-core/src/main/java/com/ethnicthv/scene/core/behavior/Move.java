package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Moves the sprite by a fixed offset at a given speed.
 * <p>
 * Each axis keeps its own remaining distance and is capped so it never overshoots,
 * so axes of different lengths finish independently. The sign of the offset gives the
 * direction; the sign of the velocity is ignored.
 */
public final class Move extends BaseBehavior {

    private final boolean negativeX;
    private final boolean negativeY;
    private final Vector2 velocity;
    private float xLeft;
    private float yLeft;

    public Move(Vector2 offset, Vector2 velocity) {
        Objects.requireNonNull(offset, "offset");
        this.velocity = Objects.requireNonNull(velocity, "velocity");
        this.negativeX = offset.x() < 0f;
        this.negativeY = offset.y() < 0f;
        this.xLeft = Math.abs(offset.x());
        this.yLeft = Math.abs(offset.y());
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        float x = xLeft > 0f ? Math.min(Math.abs(velocity.x() * deltaTime), xLeft) : 0f;
        float y = yLeft > 0f ? Math.min(Math.abs(velocity.y() * deltaTime), yLeft) : 0f;

        xLeft -= x;
        yLeft -= y;

        sprite.setPosition(sprite.getPosition().plus(negativeX ? -x : x, negativeY ? -y : y));
    }

    @Override
    public boolean enabled(Sprite sprite) {
        return xLeft > 0f || yLeft > 0f;
    }
}
