package com.ethnicthv.scene.core.api;

/**
 * IControls - snapshot of the host's directional input, queried by player-driven behaviors.
 */
public interface IControls {

    /** Whether a "move left" input is currently held. */
    boolean left();

    /** Whether a "move right" input is currently held. */
    boolean right();
}
