package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.Objects;

/**
 * Runs arbitrary code every tick it is executed. Always enabled, never removed.
 * <p>
 * This is the one sanctioned way to put opaque code inside a composition, e.g. firing a
 * bullet at the end of a {@link Sequence}. Wrap it in {@link Exactly} to bound it.
 */
public final class Callback extends BaseBehavior {

    /** The code run by a {@link Callback}. */
    @FunctionalInterface
    public interface Action {
        void run(float deltaTime, Sprite sprite);
    }

    private final Action action;

    public Callback(Action action) {
        this.action = Objects.requireNonNull(action, "action");
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        action.run(deltaTime, sprite);
    }
}
