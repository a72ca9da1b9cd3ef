package com.ethnicthv.scene.demo;

import com.ethnicthv.scene.core.api.Colour;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.GameObject;
import com.ethnicthv.scene.core.node.NodeConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Scrolling starfield built purely from handlers, no subclassing.
 */
final class Starfield {

    static final int STARS_TOTAL = 200;
    static final int MIN_SPEED = 75;
    static final int MAX_SPEED = 150;

    private record Star(float x, float y, float speed) {
    }

    private Starfield() {
    }

    static GameObject create(float width, float height, RandomGenerator random) {
        List<Star> stars = new ArrayList<>();

        return new GameObject(NodeConfig.builder()
                .name("starfield")
                .onActivate(self -> {
                    stars.clear();
                    for (int i = 0; i < STARS_TOTAL; i++) {
                        stars.add(new Star(random.nextFloat() * width, random.nextFloat() * height,
                                random.nextInt(MIN_SPEED, MAX_SPEED + 1)));
                    }
                })
                .onUpdate((self, dt) -> {
                    // Move down, drop the ones that left the screen, refill at the top
                    stars.replaceAll(s -> new Star(s.x(), s.y() + s.speed() * dt, s.speed()));
                    stars.removeIf(s -> s.y() >= height);
                    while (stars.size() < STARS_TOTAL) {
                        stars.add(new Star(random.nextFloat() * width, 0f, random.nextInt(MIN_SPEED, MAX_SPEED + 1)));
                    }
                })
                .onDraw((self, surface) -> {
                    for (Star star : stars) {
                        surface.filledCircle(new Vector2(star.x(), star.y()), 1f, Colour.WHITE);
                    }
                })
                .build());
    }
}
