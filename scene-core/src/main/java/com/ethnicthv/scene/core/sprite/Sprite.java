package com.ethnicthv.scene.core.sprite;

import com.ethnicthv.scene.core.api.ISurface;
import com.ethnicthv.scene.core.api.SpriteImage;
import com.ethnicthv.scene.core.behavior.IBehavior;
import com.ethnicthv.scene.core.math.Rect;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.GameObject;
import com.ethnicthv.scene.core.node.NodeConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Sprite - an animated, behavior-driven {@link GameObject}.
 * <p>
 * Each update (while active and enabled) a sprite:
 * <ol>
 *     <li>counts down its lifetime, if it has one, and destroys itself as soon as it
 *     reaches zero, doing nothing else that tick;</li>
 *     <li>advances its image animation;</li>
 *     <li>evicts behaviors that ask to be removed, then executes the enabled ones in order.</li>
 * </ol>
 * The position is the centre of the current image. The normal position is an anchor
 * used by {@link com.ethnicthv.scene.core.behavior.OverridePosition} and
 * {@link com.ethnicthv.scene.core.behavior.ReturnToNormalPosition}; it starts out equal
 * to the initial position.
 */
public class Sprite extends GameObject {

    private static final Logger LOGGER = LogManager.getLogger(Sprite.class);

    public static final float DEFAULT_FPS = 2.0f;

    private Vector2 position;
    private Vector2 normalPosition;

    private final List<SpriteImage> images;
    private float fps = DEFAULT_FPS;
    private int frame = -1;
    private float frameTime;

    private final List<IBehavior> behaviors = new ArrayList<>();

    // NaN means "lives forever"
    private float lifetime = Float.NaN;

    public Sprite(Vector2 position, List<SpriteImage> images, IBehavior... behaviors) {
        this(position, images, NodeConfig.DEFAULT, behaviors);
    }

    /**
     * @param position   initial centre position
     * @param images     animation frames, at least one
     * @param config     node options; activate handlers in it fire before this constructor
     *                   body runs, so they must not rely on sprite state
     * @param behaviors  initial behaviors, in execution order
     */
    public Sprite(Vector2 position, List<SpriteImage> images, NodeConfig config, IBehavior... behaviors) {
        super(config);
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(images, "images");
        if (images.isEmpty()) {
            throw new IllegalArgumentException("A sprite needs at least one image");
        }
        this.position = position;
        this.normalPosition = position;
        this.images = List.copyOf(images);
        for (IBehavior behavior : behaviors) {
            addBehavior(behavior);
        }
    }

    // =================================================================
    // Frame work
    // =================================================================

    @Override
    protected void onUpdate(float deltaTime) {
        if (hasLifetime()) {
            lifetime -= deltaTime;
            if (lifetime <= 0f) {
                LOGGER.debug("Lifetime of {} expired", this);
                destroy();
                return;
            }
        }

        animate(deltaTime);
        runBehaviors(deltaTime);
    }

    private void animate(float deltaTime) {
        if (frame < 0) {
            frame = 0;
            frameTime = 0f;
            return;
        }

        frameTime += deltaTime;
        float period = 1.0f / fps;
        if (frameTime < period) {
            return;
        }
        // Constant time for any delta, so a long pause cannot stall the frame.
        long steps = (long) (frameTime / period);
        frame = (int) ((frame + steps) % images.size());
        frameTime %= period;
    }

    private void runBehaviors(float deltaTime) {
        behaviors.removeIf(behavior -> {
            if (!behavior.remove(this)) {
                return false;
            }
            LOGGER.trace("Evicted {} from {}", behavior, this);
            return true;
        });

        // Snapshot: behaviors added during the pass first run next tick.
        for (IBehavior behavior : List.copyOf(behaviors)) {
            if (isDestroyed()) {
                return;
            }
            if (behavior.enabled(this)) {
                behavior.execute(deltaTime, this);
            }
        }
    }

    @Override
    protected void onDraw(ISurface surface) {
        surface.blit(currentImage(), position);
    }

    @Override
    protected void onActivated() {
        frame = -1;
        frameTime = 0f;
    }

    // =================================================================
    // Position
    // =================================================================

    public Vector2 getPosition() {
        return position;
    }

    public void setPosition(Vector2 position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public void setPosition(float x, float y) {
        this.position = new Vector2(x, y);
    }

    public Vector2 getNormalPosition() {
        return normalPosition;
    }

    public void setNormalPosition(Vector2 normalPosition) {
        this.normalPosition = Objects.requireNonNull(normalPosition, "normalPosition");
    }

    /** Rectangle of the current image's size centred on the position. */
    public Rect bounds() {
        SpriteImage image = currentImage();
        return Rect.centredOn(position, image.width(), image.height());
    }

    // =================================================================
    // Animation
    // =================================================================

    public List<SpriteImage> getImages() {
        return images;
    }

    /** The image shown now. Before the first update this is the first image. */
    public SpriteImage currentImage() {
        return images.get(Math.max(frame, 0));
    }

    /** Current frame index, or -1 before the first update after activation. */
    public int getFrame() {
        return frame;
    }

    public float getFps() {
        return fps;
    }

    public void setFps(float fps) {
        if (!(fps > 0f)) {
            throw new IllegalArgumentException("fps must be > 0, got " + fps);
        }
        this.fps = fps;
    }

    // =================================================================
    // Lifetime
    // =================================================================

    /** Destroy this sprite after {@code seconds} of updates. */
    public void setLifetime(float seconds) {
        if (!(seconds > 0f)) {
            throw new IllegalArgumentException("lifetime must be > 0, got " + seconds);
        }
        this.lifetime = seconds;
    }

    public void clearLifetime() {
        this.lifetime = Float.NaN;
    }

    public boolean hasLifetime() {
        return !Float.isNaN(lifetime);
    }

    /** Seconds left to live, or NaN when the sprite has no lifetime. */
    public float getLifetime() {
        return lifetime;
    }

    // =================================================================
    // Behaviors
    // =================================================================

    /** Appends a behavior. Added during an update, it first runs on the next tick. */
    public void addBehavior(IBehavior behavior) {
        behaviors.add(Objects.requireNonNull(behavior, "behavior"));
    }

    /** Removes the first occurrence of {@code behavior}. */
    public boolean removeBehavior(IBehavior behavior) {
        return behaviors.remove(behavior);
    }

    public List<IBehavior> getBehaviors() {
        return Collections.unmodifiableList(behaviors);
    }
}
