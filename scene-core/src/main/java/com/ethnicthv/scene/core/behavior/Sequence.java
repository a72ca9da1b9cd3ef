package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.List;
import java.util.Objects;

/**
 * Runs its behaviors one after another.
 * <p>
 * Only the current behavior executes. {@link #enabled(Sprite)} moves past every behavior
 * that is no longer enabled and stops at the first one that still is, or at the last one.
 * The sequence therefore reports exactly what its last behavior reports once that is
 * reached; wrap it in {@link RemoveWhenFinished} to drop it when done.
 */
public final class Sequence implements IBehavior {

    private final List<IBehavior> behaviors;
    private int index;

    public Sequence(IBehavior... behaviors) {
        this(List.of(behaviors));
    }

    public Sequence(List<? extends IBehavior> behaviors) {
        Objects.requireNonNull(behaviors, "behaviors");
        if (behaviors.isEmpty()) {
            throw new IllegalArgumentException("Sequence needs at least one behavior");
        }
        this.behaviors = List.copyOf(behaviors);
    }

    @Override
    public boolean enabled(Sprite sprite) {
        while (!behaviors.get(index).enabled(sprite) && index < behaviors.size() - 1) {
            index++;
        }
        return behaviors.get(index).enabled(sprite);
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        behaviors.get(index).execute(deltaTime, sprite);
    }

    @Override
    public boolean remove(Sprite sprite) {
        return false;
    }

    /** Index of the behavior that currently runs. */
    public int currentIndex() {
        return index;
    }
}
