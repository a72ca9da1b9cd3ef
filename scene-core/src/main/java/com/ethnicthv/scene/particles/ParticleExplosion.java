package com.ethnicthv.scene.particles;

import com.ethnicthv.scene.core.api.Colour;
import com.ethnicthv.scene.core.api.ISurface;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.GameObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * A burst of single-pixel particles flying out of a point and falling under gravity.
 * Destroys itself once its lifetime runs out.
 */
public class ParticleExplosion extends GameObject {

    public static final float GRAVITY = 60f;
    public static final int MIN_VELOCITY = -90;
    public static final int MAX_VELOCITY = 90;

    private final Colour colour;
    private final List<Particle> particles;
    private float left;

    /** One particle: position and velocity. */
    public record Particle(float x, float y, float vx, float vy) {
    }

    public ParticleExplosion(Vector2 position, float lifetime, Colour colour, int count, RandomGenerator random) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(random, "random");
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        this.colour = Objects.requireNonNull(colour, "colour");
        this.left = lifetime;
        this.particles = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            particles.add(new Particle(position.x(), position.y(),
                    random.nextInt(MIN_VELOCITY, MAX_VELOCITY + 1),
                    random.nextInt(MIN_VELOCITY, MAX_VELOCITY + 1)));
        }
    }

    @Override
    protected void onUpdate(float deltaTime) {
        left -= deltaTime;

        particles.replaceAll(p -> new Particle(
                p.x() + p.vx() * deltaTime,
                p.y() + p.vy() * deltaTime,
                p.vx(),
                p.vy() + GRAVITY * deltaTime));

        if (left < 0f) {
            destroy();
        }
    }

    @Override
    protected void onDraw(ISurface surface) {
        for (Particle particle : particles) {
            surface.filledCircle(new Vector2(particle.x(), particle.y()), 1f, colour);
        }
    }

    public List<Particle> getParticles() {
        return Collections.unmodifiableList(particles);
    }

    public float getTimeLeft() {
        return left;
    }
}
