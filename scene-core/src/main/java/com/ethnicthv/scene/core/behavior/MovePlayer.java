package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.api.IControls;
import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Horizontal movement steered by the host's controls, clamped to {@code [minX, maxX]}.
 * When both directions are held, left wins.
 */
public final class MovePlayer extends BaseBehavior {

    private final IControls controls;
    private final float speed;
    private final float minX;
    private final float maxX;

    public MovePlayer(IControls controls, float speed, float minX, float maxX) {
        if (minX > maxX) {
            throw new IllegalArgumentException("minX must be <= maxX, got " + minX + " > " + maxX);
        }
        this.controls = Objects.requireNonNull(controls, "controls");
        this.speed = speed;
        this.minX = minX;
        this.maxX = maxX;
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        float x = sprite.getPosition().x();
        if (controls.left()) {
            x -= speed * deltaTime;
        } else if (controls.right()) {
            x += speed * deltaTime;
        }

        x = Math.max(minX, Math.min(maxX, x));
        sprite.setPosition(sprite.getPosition().withX(x));
    }
}
