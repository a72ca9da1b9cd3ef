package com.ethnicthv.scene;

import com.ethnicthv.scene.core.api.Colour;
import com.ethnicthv.scene.core.api.ISurface;
import com.ethnicthv.scene.core.node.GameObject;
import com.ethnicthv.scene.core.node.NodeConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Root - the single integration point between the host runtime and the scene.
 * <p>
 * Owns the top-level forest, the per-frame callback lists and the background colour.
 * The host builds exactly one Root at startup, calls {@link #update(float)} and
 * {@link #draw(ISurface)} once per frame, and {@link #close()} at shutdown. Anything that
 * needs to register objects or callbacks gets the Root passed in.
 */
public final class Root implements AutoCloseable {

    private static final Logger LOGGER = LogManager.getLogger(Root.class);

    /** Per-frame callback run before the tree is drawn. */
    @FunctionalInterface
    public interface DrawFunc {
        void draw(ISurface surface);
    }

    /** Per-frame callback run before the tree is updated. */
    @FunctionalInterface
    public interface UpdateFunc {
        void update(float deltaTime);
    }

    private final GameObject tree;
    private final List<DrawFunc> drawFuncs = new ArrayList<>();
    private final List<UpdateFunc> updateFuncs = new ArrayList<>();
    private Colour backgroundColour;
    private boolean closed;

    // Private constructor, use Root.builder() instead.
    private Root(Colour backgroundColour) {
        this.tree = new GameObject(NodeConfig.builder().name("root").build());
        this.backgroundColour = backgroundColour;
    }

    public static Builder builder() {
        return new Builder();
    }

    // =================================================================
    // Frame entry points
    // =================================================================

    /**
     * Clear the surface to the background colour, run the draw funcs, then draw the tree.
     */
    public void draw(ISurface surface) {
        Objects.requireNonNull(surface, "surface");
        ensureOpen();

        surface.fill(backgroundColour);
        for (DrawFunc func : List.copyOf(drawFuncs)) {
            func.draw(surface);
        }
        tree.draw(surface);
    }

    /**
     * Run the update funcs, then update the tree.
     *
     * @param deltaTime seconds since the previous frame
     */
    public void update(float deltaTime) {
        ensureOpen();

        for (UpdateFunc func : List.copyOf(updateFuncs)) {
            func.update(deltaTime);
        }
        tree.update(deltaTime);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Root has been closed");
        }
    }

    // =================================================================
    // Registration
    // =================================================================

    /** Add a top-level object. */
    public <T extends GameObject> T addGameObject(T gameObject) {
        return tree.addChild(gameObject);
    }

    public void removeGameObject(GameObject gameObject) {
        tree.removeChild(gameObject);
    }

    /** Top-level objects, in draw/update order. */
    public List<GameObject> getGameObjects() {
        return tree.getChildren();
    }

    public void addDrawFunc(DrawFunc func) {
        drawFuncs.add(Objects.requireNonNull(func, "func"));
    }

    public void addUpdateFunc(UpdateFunc func) {
        updateFuncs.add(Objects.requireNonNull(func, "func"));
    }

    public Colour getBackgroundColour() {
        return backgroundColour;
    }

    public void setBackgroundColour(Colour colour) {
        this.backgroundColour = Objects.requireNonNull(colour, "colour");
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Destroys the whole forest and drops the callbacks. Frame calls fail afterwards.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        tree.destroy();
        drawFuncs.clear();
        updateFuncs.clear();
        LOGGER.info("Root closed");
    }

    // =================================================================
    // Builder Implementation
    // =================================================================

    public static class Builder {
        private Colour backgroundColour = Colour.BLACK;
        private final List<GameObject> gameObjects = new ArrayList<>();
        private final List<DrawFunc> drawFuncs = new ArrayList<>();
        private final List<UpdateFunc> updateFuncs = new ArrayList<>();

        public Builder backgroundColour(Colour colour) {
            this.backgroundColour = Objects.requireNonNull(colour, "colour");
            return this;
        }

        public Builder addGameObject(GameObject gameObject) {
            gameObjects.add(Objects.requireNonNull(gameObject, "gameObject"));
            return this;
        }

        public Builder addDrawFunc(DrawFunc func) {
            drawFuncs.add(Objects.requireNonNull(func, "func"));
            return this;
        }

        public Builder addUpdateFunc(UpdateFunc func) {
            updateFuncs.add(Objects.requireNonNull(func, "func"));
            return this;
        }

        public Root build() {
            Root root = new Root(backgroundColour);
            drawFuncs.forEach(root::addDrawFunc);
            updateFuncs.forEach(root::addUpdateFunc);
            for (GameObject gameObject : gameObjects) {
                root.addGameObject(gameObject);
            }
            LOGGER.info("Root created with {} top-level objects, {} draw funcs, {} update funcs",
                    gameObjects.size(), drawFuncs.size(), updateFuncs.size());
            return root;
        }
    }
}
