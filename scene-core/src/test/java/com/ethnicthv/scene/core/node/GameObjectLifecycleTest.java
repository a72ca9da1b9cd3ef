package com.ethnicthv.scene.core.node;

import com.ethnicthv.scene.core.api.RecordingSurface;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GameObject lifecycle")
public class GameObjectLifecycleTest {

    private static NodeConfig.Builder logging(String name, List<String> log) {
        return NodeConfig.builder()
                .name(name)
                .onActivate(self -> log.add(name + ":activate"))
                .onDeactivate(self -> log.add(name + ":deactivate"))
                .onDestroy(self -> log.add(name + ":destroy"));
    }

    @Nested
    @DisplayName("Activation")
    class Activation {

        @Test
        @DisplayName("Parent handlers run before children, children in order")
        void activationIsTopDown() {
            List<String> log = new ArrayList<>();
            GameObject c1 = new GameObject(logging("c1", log).active(false).build());
            GameObject c2 = new GameObject(logging("c2", log).active(false).build());
            GameObject parent = new GameObject(logging("parent", log).active(false).children(c1, c2).build());
            assertTrue(log.isEmpty(), "Nothing should fire for nodes built inactive");

            parent.setActive(true);

            assertEquals(List.of("parent:activate", "c1:activate", "c2:activate"), log);
            assertTrue(c1.isActive());
            assertTrue(c2.isActive());
        }

        @Test
        @DisplayName("Config children take the state of a parent built inactive")
        void configChildrenFollowInactiveParent() {
            List<String> log = new ArrayList<>();
            GameObject child = new GameObject(logging("child", log).build());
            GameObject parent = new GameObject(logging("parent", log).active(false).child(child).build());
            assertFalse(child.isActive());
            log.clear();

            parent.setActive(true);

            assertEquals(List.of("parent:activate", "child:activate"), log);
            assertTrue(child.isActive());
        }

        @Test
        @DisplayName("Deactivation propagates to the whole subtree")
        void deactivationPropagates() {
            GameObject grandChild = new GameObject("grandChild");
            GameObject child = new GameObject(NodeConfig.builder().child(grandChild).build());
            GameObject parent = new GameObject(NodeConfig.builder().child(child).build());

            parent.setActive(false);

            assertFalse(child.isActive());
            assertFalse(grandChild.isActive());
        }

        @Test
        @DisplayName("Assigning the current value fires nothing")
        void unchangedValueIsNoOp() {
            List<String> log = new ArrayList<>();
            GameObject node = new GameObject(logging("n", log).build());
            log.clear();

            node.setActive(true);

            assertTrue(log.isEmpty());
        }

        @Test
        @DisplayName("A node built active fires its activate handlers exactly once")
        void constructedActiveFiresOnce() {
            List<String> log = new ArrayList<>();
            new GameObject(logging("n", log).build());
            assertEquals(List.of("n:activate"), log);
        }

        @Test
        @DisplayName("enabled and visible stay local when the parent changes")
        void localFlagsDoNotPropagate() {
            GameObject child = new GameObject();
            GameObject parent = new GameObject(NodeConfig.builder().child(child).build());

            parent.setEnabled(false);
            parent.setVisible(false);

            assertTrue(child.isEnabled());
            assertTrue(child.isVisible());
        }

        @Test
        @DisplayName("Template hook runs before the handlers")
        void hookBeforeHandlers() {
            List<String> log = new ArrayList<>();
            GameObject node = new GameObject(NodeConfig.builder()
                    .active(false)
                    .onActivate(self -> log.add("handler"))
                    .build()) {
                @Override
                protected void onActivated() {
                    log.add("hook");
                }
            };

            node.setActive(true);

            assertEquals(List.of("hook", "handler"), log);
        }
    }

    @Nested
    @DisplayName("Destruction")
    class Destruction {

        @Test
        @DisplayName("Children are destroyed before the parent's own teardown")
        void destructionIsBottomUp() {
            List<String> log = new ArrayList<>();
            GameObject c1 = new GameObject(logging("c1", log).build());
            GameObject c2 = new GameObject(logging("c2", log).build());
            GameObject parent = new GameObject(logging("parent", log).children(c1, c2).build());
            log.clear();

            parent.destroy();

            assertEquals(List.of(
                    "c1:deactivate", "c1:destroy",
                    "c2:deactivate", "c2:destroy",
                    "parent:deactivate", "parent:destroy"), log);
            assertTrue(parent.isDestroyed());
            assertTrue(c1.isDestroyed());
            assertTrue(c2.isDestroyed());
        }

        @Test
        @DisplayName("destroy() twice fires destroy handlers once")
        void destroyIsIdempotent() {
            int[] destroyed = {0};
            GameObject node = new GameObject(NodeConfig.builder().onDestroy(self -> destroyed[0]++).build());

            node.destroy();
            node.destroy();

            assertEquals(1, destroyed[0]);
        }

        @Test
        @DisplayName("A destroyed node can never become active again")
        void destroyedStaysInactive() {
            GameObject node = new GameObject();
            node.destroy();

            node.setActive(true);

            assertFalse(node.isActive());
            assertTrue(node.isDestroyed());
        }

        @Test
        @DisplayName("Destroying an already inactive node fires no deactivate handler")
        void inactiveDestroySkipsDeactivate() {
            List<String> log = new ArrayList<>();
            GameObject node = new GameObject(logging("n", log).active(false).build());

            node.destroy();

            assertEquals(List.of("n:destroy"), log);
        }

        @Test
        @DisplayName("onDestroyed hook runs before destroy handlers")
        void destroyHookOrder() {
            List<String> log = new ArrayList<>();
            GameObject node = new GameObject(NodeConfig.builder().onDestroy(self -> log.add("handler")).build()) {
                @Override
                protected void onDestroyed() {
                    log.add("hook");
                }
            };

            node.destroy();

            assertEquals(List.of("hook", "handler"), log);
        }
    }

    @Nested
    @DisplayName("Update and draw")
    class Frames {

        @Test
        @DisplayName("Destroyed children are reaped at the start of the parent's next update")
        void deferredReaping() {
            GameObject child = new GameObject("child");
            GameObject parent = new GameObject(NodeConfig.builder().child(child).build());

            child.destroy();
            assertSame(parent, child.getParent(), "Still attached until the parent updates");
            assertEquals(1, parent.getChildren().size());

            parent.update(0.016f);

            assertTrue(parent.getChildren().isEmpty());
            assertNull(child.getParent());
        }

        @Test
        @DisplayName("Reaping happens even while the parent is inactive")
        void reapingWhileInactive() {
            GameObject child = new GameObject();
            GameObject parent = new GameObject(NodeConfig.builder().child(child).build());
            parent.setActive(false);
            child.destroy();

            parent.update(0.016f);

            assertTrue(parent.getChildren().isEmpty());
        }

        @Test
        @DisplayName("Update handlers receive the node and the delta time")
        void updateHandlerArguments() {
            List<Object> seen = new ArrayList<>();
            GameObject node = new GameObject(NodeConfig.builder()
                    .onUpdate((self, dt) -> {
                        seen.add(self);
                        seen.add(dt);
                    })
                    .build());

            node.update(0.5f);

            assertEquals(List.of(node, 0.5f), seen);
        }

        @Test
        @DisplayName("Disabled node skips its own handlers but still updates its children")
        void disabledStillUpdatesChildren() {
            int[] calls = {0, 0};
            GameObject child = new GameObject(NodeConfig.builder().onUpdate((self, dt) -> calls[1]++).build());
            GameObject parent = new GameObject(NodeConfig.builder()
                    .enabled(false)
                    .onUpdate((self, dt) -> calls[0]++)
                    .child(child)
                    .build());

            parent.update(0.1f);

            assertEquals(0, calls[0]);
            assertEquals(1, calls[1]);
        }

        @Test
        @DisplayName("Inactive node updates and draws nothing below it")
        void inactiveSubtreeIsSkipped() {
            int[] calls = {0};
            GameObject child = new GameObject(NodeConfig.builder()
                    .onUpdate((self, dt) -> calls[0]++)
                    .onDraw((self, surface) -> calls[0]++)
                    .build());
            GameObject parent = new GameObject(NodeConfig.builder().child(child).build());
            parent.setActive(false);

            parent.update(0.1f);
            parent.draw(new RecordingSurface());

            assertEquals(0, calls[0]);
        }

        @Test
        @DisplayName("Invisible node skips its own draw but still draws its children")
        void invisibleStillDrawsChildren() {
            RecordingSurface surface = new RecordingSurface();
            GameObject child = new GameObject(NodeConfig.builder()
                    .onDraw((self, s) -> s.text("child", null, null, 0f))
                    .build());
            GameObject parent = new GameObject(NodeConfig.builder()
                    .visible(false)
                    .onDraw((self, s) -> s.text("parent", null, null, 0f))
                    .child(child)
                    .build());

            parent.draw(surface);

            assertEquals(List.of("text child"), surface.calls);
        }

        @Test
        @DisplayName("Children are updated in insertion order after the parent")
        void updateOrder() {
            List<String> log = new ArrayList<>();
            GameObject a = new GameObject(NodeConfig.builder().onUpdate((self, dt) -> log.add("a")).build());
            GameObject b = new GameObject(NodeConfig.builder().onUpdate((self, dt) -> log.add("b")).build());
            GameObject parent = new GameObject(NodeConfig.builder()
                    .onUpdate((self, dt) -> log.add("parent"))
                    .children(a, b)
                    .build());

            parent.update(0.1f);

            assertEquals(List.of("parent", "a", "b"), log);
        }

        @Test
        @DisplayName("A child added during an update is first updated on the next tick")
        void childAddedMidPass() {
            int[] spawnedUpdates = {0};
            GameObject parent = new GameObject();
            parent.addUpdateHandler((self, dt) -> {
                if (self.getChildren().isEmpty()) {
                    self.addChild(new GameObject(NodeConfig.builder()
                            .onUpdate((s, d) -> spawnedUpdates[0]++)
                            .build()));
                }
            });

            parent.update(0.1f);
            assertEquals(0, spawnedUpdates[0]);

            parent.update(0.1f);
            assertEquals(1, spawnedUpdates[0]);
        }

        @Test
        @DisplayName("A node destroyed by its own update handler does not update its children")
        void destroyedMidUpdate() {
            int[] childUpdates = {0};
            GameObject child = new GameObject(NodeConfig.builder().onUpdate((s, d) -> childUpdates[0]++).build());
            GameObject node = new GameObject(NodeConfig.builder()
                    .onUpdate((self, dt) -> self.destroy())
                    .child(child)
                    .build());

            node.update(0.1f);

            assertEquals(0, childUpdates[0]);
            assertTrue(child.isDestroyed());
        }
    }

    @Nested
    @DisplayName("Handler registration")
    class Handlers {

        @Test
        @DisplayName("Duplicate registrations fire once each; removal drops the first match")
        void duplicates() {
            int[] calls = {0};
            GameObject.UpdateHandler handler = (self, dt) -> calls[0]++;
            GameObject node = new GameObject();
            node.addUpdateHandler(handler);
            node.addUpdateHandler(handler);

            node.update(0.1f);
            assertEquals(2, calls[0]);

            assertTrue(node.removeUpdateHandler(handler));
            node.update(0.1f);
            assertEquals(3, calls[0]);
        }

        @Test
        @DisplayName("Removing an unknown handler reports false")
        void removeUnknown() {
            GameObject node = new GameObject();
            assertFalse(node.removeDrawHandler((self, surface) -> { }));
        }

        @Test
        @DisplayName("Handler lists from the config keep their order")
        void configListsAppendInOrder() {
            List<String> log = new ArrayList<>();
            GameObject node = new GameObject(NodeConfig.builder()
                    .onUpdate(List.of((self, dt) -> log.add("1"), (self, dt) -> log.add("2")))
                    .onUpdate((self, dt) -> log.add("3"))
                    .build());

            node.update(0.1f);

            assertEquals(List.of("1", "2", "3"), log);
        }

        @Test
        @DisplayName("A handler may unregister itself while firing")
        void selfRemovalWhileFiring() {
            int[] calls = {0};
            GameObject node = new GameObject();
            GameObject.UpdateHandler once = new GameObject.UpdateHandler() {
                @Override
                public void update(GameObject self, float deltaTime) {
                    calls[0]++;
                    self.removeUpdateHandler(this);
                }
            };
            node.addUpdateHandler(once);

            node.update(0.1f);
            node.update(0.1f);

            assertEquals(1, calls[0]);
        }
    }
}
