package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

/**
 * IBehavior - a per-tick policy applied to a {@link Sprite}.
 * <p>
 * Every tick the owning sprite:
 * <ol>
 *     <li>evicts each behavior whose {@link #remove(Sprite)} is true, without running it;</li>
 *     <li>runs {@link #execute(float, Sprite)} on each remaining behavior whose
 *     {@link #enabled(Sprite)} is true, in list order.</li>
 * </ol>
 * Behaviors keep only private state (elapsed time, captured positions). Combinators
 * receive their children at construction and never change them, so a composition is
 * always a tree.
 */
public interface IBehavior {

    /** Whether this behavior should run this tick. May advance internal state (see {@link Sequence}). */
    boolean enabled(Sprite sprite);

    /**
     * Apply the behavior to {@code sprite}.
     *
     * @param deltaTime seconds since the previous tick
     */
    void execute(float deltaTime, Sprite sprite);

    /** Whether the owning sprite should drop this behavior for good. */
    boolean remove(Sprite sprite);
}
