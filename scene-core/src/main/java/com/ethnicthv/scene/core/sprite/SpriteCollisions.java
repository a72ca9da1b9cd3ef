package com.ethnicthv.scene.core.sprite;

import com.ethnicthv.scene.core.node.GameObject;
import com.ethnicthv.scene.core.node.NodeConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Checks groups of sprites against each other every tick.
 * <p>
 * A detection is two group queries plus a callback. The queries are re-evaluated on
 * every update, so they can simply look at the live tree. For every pair in the cross
 * product whose members are both still alive and whose bounds overlap, the callback
 * runs once. A pair matched by several detections is reported once per detection.
 * <p>
 * Add it to the tree like any other node; it only works while active and enabled.
 */
public class SpriteCollisions extends GameObject {

    private static final Logger LOGGER = LogManager.getLogger(SpriteCollisions.class);

    /** Called for each overlapping pair. */
    @FunctionalInterface
    public interface CollisionHandler<A extends Sprite, B extends Sprite> {
        void onCollision(A first, B second);
    }

    private final List<Detection<?, ?>> detections = new ArrayList<>();

    public SpriteCollisions() {
        super();
    }

    public SpriteCollisions(NodeConfig config) {
        super(config);
    }

    /**
     * Register a detection rule. Rules are checked in registration order.
     *
     * @param first   supplies the first group each tick
     * @param second  supplies the second group each tick
     * @param handler receives (member of first, member of second)
     */
    public <A extends Sprite, B extends Sprite> void addDetection(
            Supplier<? extends Iterable<? extends A>> first,
            Supplier<? extends Iterable<? extends B>> second,
            CollisionHandler<? super A, ? super B> handler) {
        detections.add(new Detection<A, B>(
                Objects.requireNonNull(first, "first"),
                Objects.requireNonNull(second, "second"),
                Objects.requireNonNull(handler, "handler")));
    }

    public int detectionCount() {
        return detections.size();
    }

    public void clearDetections() {
        detections.clear();
    }

    @Override
    protected void onUpdate(float deltaTime) {
        for (Detection<?, ?> detection : List.copyOf(detections)) {
            detection.check();
        }
    }

    private record Detection<A extends Sprite, B extends Sprite>(
            Supplier<? extends Iterable<? extends A>> first,
            Supplier<? extends Iterable<? extends B>> second,
            CollisionHandler<? super A, ? super B> handler) {

        void check() {
            // Copies, so callbacks may spawn or remove sprites in either group.
            List<A> firstGroup = snapshot(first.get());
            List<B> secondGroup = snapshot(second.get());

            for (A a : firstGroup) {
                for (B b : secondGroup) {
                    if (a.isDestroyed() || b.isDestroyed()) {
                        continue;
                    }
                    if (a.bounds().intersects(b.bounds())) {
                        LOGGER.trace("Collision between {} and {}", a, b);
                        handler.onCollision(a, b);
                    }
                }
            }
        }

        private static <T> List<T> snapshot(Iterable<? extends T> group) {
            List<T> copy = new ArrayList<>();
            for (T member : group) {
                copy.add(member);
            }
            return copy;
        }
    }
}
