package com.ethnicthv.scene.particles;

import com.ethnicthv.scene.core.api.Colour;
import com.ethnicthv.scene.core.api.ISurface;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.GameObject;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * A score value that pops out of a point, drifts and falls, then disappears.
 */
public class ParticleScore extends GameObject {

    public static final float GRAVITY = ParticleExplosion.GRAVITY;
    public static final int MIN_VX = -60;
    public static final int MAX_VX = 60;
    public static final int MIN_VY = -30;
    public static final int MAX_VY = 60;
    public static final float FONT_SIZE = 24f;

    private final int value;
    private Vector2 position;
    private float vx;
    private float vy;
    private float left;

    public ParticleScore(Vector2 position, float lifetime, int value, RandomGenerator random) {
        Objects.requireNonNull(random, "random");
        this.position = Objects.requireNonNull(position, "position");
        this.left = lifetime;
        this.value = value;
        this.vx = random.nextInt(MIN_VX, MAX_VX + 1);
        this.vy = random.nextInt(MIN_VY, MAX_VY + 1);
    }

    @Override
    protected void onUpdate(float deltaTime) {
        left -= deltaTime;
        vy += GRAVITY * deltaTime;
        position = position.plus(vx * deltaTime, vy * deltaTime);

        if (left < 0f) {
            destroy();
        }
    }

    @Override
    protected void onDraw(ISurface surface) {
        surface.text(Integer.toString(value), position, Colour.YELLOW, FONT_SIZE);
    }

    public Vector2 getPosition() {
        return position;
    }

    public int getValue() {
        return value;
    }

    public float getVelocityX() {
        return vx;
    }

    public float getVelocityY() {
        return vy;
    }
}
