package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Moves the sprite back toward its {@linkplain Sprite#getNormalPosition() normal position}
 * at a capped per-axis speed. Enabled exactly while the sprite is away from it.
 */
public final class ReturnToNormalPosition extends BaseBehavior {

    private final Vector2 velocity;

    public ReturnToNormalPosition(Vector2 velocity) {
        this.velocity = Objects.requireNonNull(velocity, "velocity");
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        Vector2 position = sprite.getPosition();
        Vector2 normal = sprite.getNormalPosition();

        sprite.setPosition(
                approach(position.x(), normal.x(), Math.abs(velocity.x() * deltaTime)),
                approach(position.y(), normal.y(), Math.abs(velocity.y() * deltaTime)));
    }

    private static float approach(float from, float to, float step) {
        if (from > to) {
            return Math.max(to, from - step);
        }
        if (from < to) {
            return Math.min(to, from + step);
        }
        return from;
    }

    @Override
    public boolean enabled(Sprite sprite) {
        // Numeric comparison: record equality tells -0.0 and 0.0 apart.
        Vector2 position = sprite.getPosition();
        Vector2 normal = sprite.getNormalPosition();
        return position.x() != normal.x() || position.y() != normal.y();
    }
}
