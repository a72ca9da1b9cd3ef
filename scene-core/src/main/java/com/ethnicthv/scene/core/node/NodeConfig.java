package com.ethnicthv.scene.core.node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Construction options for a {@link GameObject}.
 * <p>
 * Handlers may be supplied one at a time or as lists; either way they are appended
 * to the node's handler list for that event in the order given. Children are attached
 * through {@link GameObject#addChild(GameObject)}, so a config holding children can
 * only be used to build one node. They take the built node's active state, so children
 * of a node built inactive are inactive too.
 *
 * <pre>{@code
 * GameObject starfield = new GameObject(NodeConfig.builder()
 *         .name("starfield")
 *         .onActivate(self -> seedStars())
 *         .onUpdate((self, dt) -> moveStars(dt))
 *         .onDraw((self, surface) -> drawStars(surface))
 *         .build());
 * }</pre>
 */
public final class NodeConfig {

    /** Active, enabled, visible, unnamed, no handlers, no children. */
    public static final NodeConfig DEFAULT = builder().build();

    private final String name;
    private final boolean active;
    private final boolean enabled;
    private final boolean visible;
    private final List<GameObject> children;
    private final List<GameObject.DrawHandler> drawHandlers;
    private final List<GameObject.UpdateHandler> updateHandlers;
    private final List<GameObject.LifecycleHandler> activateHandlers;
    private final List<GameObject.LifecycleHandler> deactivateHandlers;
    private final List<GameObject.LifecycleHandler> destroyHandlers;

    private NodeConfig(Builder b) {
        this.name = b.name;
        this.active = b.active;
        this.enabled = b.enabled;
        this.visible = b.visible;
        this.children = List.copyOf(b.children);
        this.drawHandlers = List.copyOf(b.drawHandlers);
        this.updateHandlers = List.copyOf(b.updateHandlers);
        this.activateHandlers = List.copyOf(b.activateHandlers);
        this.deactivateHandlers = List.copyOf(b.deactivateHandlers);
        this.destroyHandlers = List.copyOf(b.destroyHandlers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String name() {
        return name;
    }

    public boolean active() {
        return active;
    }

    public boolean enabled() {
        return enabled;
    }

    public boolean visible() {
        return visible;
    }

    public List<GameObject> children() {
        return children;
    }

    public List<GameObject.DrawHandler> drawHandlers() {
        return drawHandlers;
    }

    public List<GameObject.UpdateHandler> updateHandlers() {
        return updateHandlers;
    }

    public List<GameObject.LifecycleHandler> activateHandlers() {
        return activateHandlers;
    }

    public List<GameObject.LifecycleHandler> deactivateHandlers() {
        return deactivateHandlers;
    }

    public List<GameObject.LifecycleHandler> destroyHandlers() {
        return destroyHandlers;
    }

    public static final class Builder {
        private String name;
        private boolean active = true;
        private boolean enabled = true;
        private boolean visible = true;
        private final List<GameObject> children = new ArrayList<>();
        private final List<GameObject.DrawHandler> drawHandlers = new ArrayList<>();
        private final List<GameObject.UpdateHandler> updateHandlers = new ArrayList<>();
        private final List<GameObject.LifecycleHandler> activateHandlers = new ArrayList<>();
        private final List<GameObject.LifecycleHandler> deactivateHandlers = new ArrayList<>();
        private final List<GameObject.LifecycleHandler> destroyHandlers = new ArrayList<>();

        private Builder() {
        }

        /** Advisory name, used for lookups and logging. Not required to be unique. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder child(GameObject child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder children(GameObject... children) {
            for (GameObject child : children) {
                child(child);
            }
            return this;
        }

        public Builder children(List<? extends GameObject> children) {
            children.forEach(this::child);
            return this;
        }

        public Builder onDraw(GameObject.DrawHandler handler) {
            drawHandlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder onDraw(List<? extends GameObject.DrawHandler> handlers) {
            handlers.forEach(this::onDraw);
            return this;
        }

        public Builder onUpdate(GameObject.UpdateHandler handler) {
            updateHandlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder onUpdate(List<? extends GameObject.UpdateHandler> handlers) {
            handlers.forEach(this::onUpdate);
            return this;
        }

        public Builder onActivate(GameObject.LifecycleHandler handler) {
            activateHandlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder onActivate(List<? extends GameObject.LifecycleHandler> handlers) {
            handlers.forEach(this::onActivate);
            return this;
        }

        public Builder onDeactivate(GameObject.LifecycleHandler handler) {
            deactivateHandlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder onDeactivate(List<? extends GameObject.LifecycleHandler> handlers) {
            handlers.forEach(this::onDeactivate);
            return this;
        }

        public Builder onDestroy(GameObject.LifecycleHandler handler) {
            destroyHandlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder onDestroy(List<? extends GameObject.LifecycleHandler> handlers) {
            handlers.forEach(this::onDestroy);
            return this;
        }

        public NodeConfig build() {
            return new NodeConfig(this);
        }
    }
}
