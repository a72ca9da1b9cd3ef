package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

/**
 * Convenience base class for behaviors.
 *
 * Provides:
 * - {@link #enabled(Sprite)} that always returns true
 * - {@link #remove(Sprite)} that always returns false
 *
 * Subclasses must implement {@link #execute(float, Sprite)}.
 */
public abstract class BaseBehavior implements IBehavior {

    @Override
    public boolean enabled(Sprite sprite) {
        return true;
    }

    @Override
    public boolean remove(Sprite sprite) {
        return false;
    }
}
