package com.ethnicthv.scene.core.api;

import com.ethnicthv.scene.core.math.Vector2;

/**
 * ISurface - drawing capability owned by the host runtime.
 * <p>
 * The engine passes the surface through its draw traversal without inspecting it.
 * Implementations decide how (or whether) anything is actually rendered.
 */
public interface ISurface {

    /** Clear the whole surface to a single colour. */
    void fill(Colour colour);

    /** Draw an image centred on {@code centre}. */
    void blit(SpriteImage image, Vector2 centre);

    void filledCircle(Vector2 centre, float radius, Colour colour);

    /** Draw text centred on {@code centre}. */
    void text(String text, Vector2 centre, Colour colour, float fontSize);
}
