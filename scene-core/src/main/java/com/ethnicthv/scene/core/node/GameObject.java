package com.ethnicthv.scene.core.node;

import com.ethnicthv.scene.core.api.ISurface;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GameObject - a node in the owned scene hierarchy.
 * <p>
 * Each node carries three independent flags:
 * <ul>
 *     <li>{@code active} - hierarchical. Changing it propagates to the whole subtree,
 *     parent first. An inactive node is neither updated nor drawn, nor are its descendants.</li>
 *     <li>{@code enabled} - local. Gates this node's own update handlers only.</li>
 *     <li>{@code visible} - local. Gates this node's own draw handlers only.</li>
 * </ul>
 * Destruction is terminal and runs bottom-up: children are destroyed before the node
 * deactivates itself and fires its destroy handlers. A destroyed node stays in its
 * parent's children list until the parent's next {@link #update(float)}, so a node can
 * be destroyed safely while the tree is being traversed.
 * <p>
 * Behaviour can be attached in two independent ways that compose: per-instance handler
 * lists (see {@link NodeConfig}) and a single template-method override per event
 * ({@link #onUpdate(float)}, {@link #onDraw(ISurface)}, {@link #onActivated()},
 * {@link #onDeactivated()}, {@link #onDestroyed()}). The override always runs before
 * the handlers of the same event.
 * <p>
 * Not thread-safe. All calls must come from the thread that drives the frame.
 */
public class GameObject {

    private static final Logger LOGGER = LogManager.getLogger(GameObject.class);

    /** Per-instance draw callback. */
    @FunctionalInterface
    public interface DrawHandler {
        void draw(GameObject self, ISurface surface);
    }

    /** Per-instance update callback. */
    @FunctionalInterface
    public interface UpdateHandler {
        void update(GameObject self, float deltaTime);
    }

    /** Per-instance activate / deactivate / destroy callback. */
    @FunctionalInterface
    public interface LifecycleHandler {
        void handle(GameObject self);
    }

    private final String name;
    private boolean active;
    private boolean enabled;
    private boolean visible;
    private boolean destroyed;

    // Non-owning back-link. Only addChild/removeChild/reaping write it.
    private GameObject parent;
    private final List<GameObject> children = new ArrayList<>();

    private final List<DrawHandler> drawHandlers = new ArrayList<>();
    private final List<UpdateHandler> updateHandlers = new ArrayList<>();
    private final List<LifecycleHandler> activateHandlers = new ArrayList<>();
    private final List<LifecycleHandler> deactivateHandlers = new ArrayList<>();
    private final List<LifecycleHandler> destroyHandlers = new ArrayList<>();

    public GameObject() {
        this(NodeConfig.DEFAULT);
    }

    public GameObject(String name) {
        this(NodeConfig.builder().name(name).build());
    }

    /**
     * Build a node from a config.
     * <p>
     * When the config asks for an active node, its activate handlers fire once here.
     * The {@link #onActivated()} override is not called from the constructor: a subclass
     * is not fully initialised yet, so it should do its own setup in its constructor.
     * Children from the config are attached and then given this node's active state.
     */
    public GameObject(NodeConfig config) {
        Objects.requireNonNull(config, "config");
        this.name = config.name();
        this.enabled = config.enabled();
        this.visible = config.visible();

        drawHandlers.addAll(config.drawHandlers());
        updateHandlers.addAll(config.updateHandlers());
        activateHandlers.addAll(config.activateHandlers());
        deactivateHandlers.addAll(config.deactivateHandlers());
        destroyHandlers.addAll(config.destroyHandlers());

        if (config.active()) {
            this.active = true;
            fire(activateHandlers);
        }

        for (GameObject child : config.children()) {
            addChild(child);
            child.setActive(this.active);
        }
    }

    // =================================================================
    // Frame entry points
    // =================================================================

    /**
     * Advance this subtree by one tick.
     * <p>
     * Destroyed children are reaped first, even when this node is inactive. Then, if the
     * node is active: when enabled, {@link #onUpdate(float)} and the update handlers run;
     * finally every remaining child is updated in order. Children added during the pass
     * are first updated on the next tick.
     */
    public void update(float deltaTime) {
        reapDestroyedChildren();
        if (!active) {
            return;
        }

        // Taken before the hook and handlers run so children they add wait a tick.
        List<GameObject> snapshot = List.copyOf(children);

        if (enabled) {
            onUpdate(deltaTime);
            if (!active) {
                return;
            }
            for (UpdateHandler handler : List.copyOf(updateHandlers)) {
                handler.update(this, deltaTime);
            }
            if (!active) {
                return;
            }
        }

        for (GameObject child : snapshot) {
            child.update(deltaTime);
        }
    }

    /**
     * Draw this subtree. Inactive nodes draw nothing. An invisible node skips its own
     * draw hook and handlers but still draws its children.
     */
    public void draw(ISurface surface) {
        if (!active) {
            return;
        }

        if (visible) {
            onDraw(surface);
            for (DrawHandler handler : List.copyOf(drawHandlers)) {
                handler.draw(this, surface);
            }
        }

        for (GameObject child : List.copyOf(children)) {
            child.draw(surface);
        }
    }

    private void reapDestroyedChildren() {
        if (children.isEmpty()) {
            return;
        }
        children.removeIf(child -> {
            if (!child.destroyed) {
                return false;
            }
            child.parent = null;
            LOGGER.debug("Reaped destroyed child {} from {}", child, this);
            return true;
        });
    }

    // =================================================================
    // Lifecycle
    // =================================================================

    /**
     * Destroy this node and its whole subtree. Children are destroyed first; then this
     * node is deactivated (firing its deactivate handlers), marked destroyed, and its
     * destroy handlers fire. Calling it again has no further effect on this node.
     */
    public void destroy() {
        for (GameObject child : List.copyOf(children)) {
            child.destroy();
        }
        if (destroyed) {
            return;
        }

        setActive(false);
        destroyed = true;
        LOGGER.debug("Destroyed {}", this);

        onDestroyed();
        fire(destroyHandlers);
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Activate or deactivate this subtree. Does nothing when the node is destroyed or the
     * value is unchanged. Otherwise this node's hook and handlers run first, then the
     * same value is assigned to every child in order.
     */
    public void setActive(boolean active) {
        if (destroyed || this.active == active) {
            return;
        }
        this.active = active;

        if (active) {
            onActivated();
            fire(activateHandlers);
        } else {
            onDeactivated();
            fire(deactivateHandlers);
        }

        for (GameObject child : List.copyOf(children)) {
            child.setActive(active);
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Local flag: does not propagate to children. */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isVisible() {
        return visible;
    }

    /** Local flag: does not propagate to children. */
    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    private void fire(List<LifecycleHandler> handlers) {
        if (handlers.isEmpty()) {
            return;
        }
        for (LifecycleHandler handler : List.copyOf(handlers)) {
            handler.handle(this);
        }
    }

    // =================================================================
    // Template hooks
    // =================================================================

    /** Runs before the update handlers while the node is active and enabled. */
    protected void onUpdate(float deltaTime) {
    }

    /** Runs before the draw handlers while the node is active and visible. */
    protected void onDraw(ISurface surface) {
    }

    protected void onActivated() {
    }

    protected void onDeactivated() {
    }

    protected void onDestroyed() {
    }

    // =================================================================
    // Tree structure
    // =================================================================

    /**
     * Attach {@code child} as the last child of this node.
     *
     * @return the child, for chaining
     * @throws StructuralViolationException if the child already has a parent, or if it is
     *                                      this node or one of its ancestors
     */
    public <T extends GameObject> T addChild(T child) {
        Objects.requireNonNull(child, "child");
        GameObject added = child;
        if (added.parent != null) {
            throw new StructuralViolationException(
                    "Cannot add " + child + " to " + this + ": already a child of " + added.parent);
        }
        for (GameObject node = this; node != null; node = node.parent) {
            if (node == added) {
                throw new StructuralViolationException(
                        "Cannot add " + child + " to " + this + ": it would become its own descendant");
            }
        }

        children.add(added);
        added.parent = this;
        LOGGER.debug("Added {} to {}", child, this);
        return child;
    }

    /**
     * Detach {@code child} from this node. Removing a node that has no parent is a no-op.
     *
     * @throws StructuralViolationException if the child belongs to another parent
     */
    public void removeChild(GameObject child) {
        Objects.requireNonNull(child, "child");
        if (child.parent == null) {
            return;
        }
        if (child.parent != this) {
            throw new StructuralViolationException(
                    "Cannot remove " + child + " from " + this + ": it is a child of " + child.parent);
        }

        children.remove(child);
        child.parent = null;
        LOGGER.debug("Removed {} from {}", child, this);
    }

    public GameObject getParent() {
        return parent;
    }

    /** Read-only live view of the children, in update/draw order. */
    public List<GameObject> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Snapshot of the direct children that are instances of {@code type}, in order.
     * Convenient as a collision group query.
     */
    public <T extends GameObject> List<T> childrenOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (GameObject child : children) {
            if (type.isInstance(child)) {
                result.add(type.cast(child));
            }
        }
        return result;
    }

    /** First direct child with the given name. */
    public Optional<GameObject> findChild(String name) {
        for (GameObject child : children) {
            if (Objects.equals(name, child.name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public String getName() {
        return name;
    }

    // =================================================================
    // Handlers
    // =================================================================

    public void addDrawHandler(DrawHandler handler) {
        drawHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    /** Removes the first registration of {@code handler}. */
    public boolean removeDrawHandler(DrawHandler handler) {
        return drawHandlers.remove(handler);
    }

    public void addUpdateHandler(UpdateHandler handler) {
        updateHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public boolean removeUpdateHandler(UpdateHandler handler) {
        return updateHandlers.remove(handler);
    }

    public void addActivateHandler(LifecycleHandler handler) {
        activateHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public boolean removeActivateHandler(LifecycleHandler handler) {
        return activateHandlers.remove(handler);
    }

    public void addDeactivateHandler(LifecycleHandler handler) {
        deactivateHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public boolean removeDeactivateHandler(LifecycleHandler handler) {
        return deactivateHandlers.remove(handler);
    }

    public void addDestroyHandler(LifecycleHandler handler) {
        destroyHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    public boolean removeDestroyHandler(LifecycleHandler handler) {
        return destroyHandlers.remove(handler);
    }

    @Override
    public String toString() {
        String label = name != null ? name : Integer.toHexString(System.identityHashCode(this));
        return getClass().getSimpleName() + "[" + label + "]";
    }
}
