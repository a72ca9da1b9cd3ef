package com.ethnicthv.scene.core.sprite;

import com.ethnicthv.scene.core.api.RecordingSurface;
import com.ethnicthv.scene.core.api.SpriteImage;
import com.ethnicthv.scene.core.behavior.Callback;
import com.ethnicthv.scene.core.behavior.IBehavior;
import com.ethnicthv.scene.core.math.Rect;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.NodeConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sprite")
public class SpriteTest {

    private static final SpriteImage A = new SpriteImage("a", 10, 20);
    private static final SpriteImage B = new SpriteImage("b", 10, 20);
    private static final SpriteImage C = new SpriteImage("c", 10, 20);

    private static Sprite sprite(IBehavior... behaviors) {
        return new Sprite(new Vector2(50, 50), List.of(A, B, C), behaviors);
    }

    @Nested
    @DisplayName("Lifetime")
    class Lifetime {

        @Test
        @DisplayName("lifetime 1.0 with dt 0.6: destroyed on the 2nd tick, no behavior runs that tick")
        void expiresOnCrossingTick() {
            int[] runs = {0};
            Sprite sprite = sprite(new Callback((dt, s) -> runs[0]++));
            sprite.setLifetime(1.0f);

            sprite.update(0.6f);
            assertFalse(sprite.isDestroyed());
            assertEquals(1, runs[0]);

            sprite.update(0.6f);
            assertTrue(sprite.isDestroyed());
            assertFalse(sprite.isActive());
            assertEquals(1, runs[0]);
        }

        @Test
        @DisplayName("Reaching exactly zero also destroys")
        void expiresAtZero() {
            Sprite sprite = sprite();
            sprite.setLifetime(0.5f);

            sprite.update(0.5f);

            assertTrue(sprite.isDestroyed());
        }

        @Test
        @DisplayName("No lifetime means the sprite lives forever; bad lifetimes are rejected")
        void lifetimeConfiguration() {
            Sprite sprite = sprite();
            assertFalse(sprite.hasLifetime());
            for (int i = 0; i < 100; i++) {
                sprite.update(1f);
            }
            assertFalse(sprite.isDestroyed());

            sprite.setLifetime(3f);
            assertTrue(sprite.hasLifetime());
            sprite.clearLifetime();
            assertFalse(sprite.hasLifetime());

            assertThrows(IllegalArgumentException.class, () -> sprite.setLifetime(0f));
            assertThrows(IllegalArgumentException.class, () -> sprite.setLifetime(Float.NaN));
        }
    }

    @Nested
    @DisplayName("Behavior execution")
    class Behaviors {

        @Test
        @DisplayName("A behavior asking to be removed is evicted without executing")
        void removedNeverRuns() {
            IBehavior doomed = new IBehavior() {
                @Override
                public boolean enabled(Sprite sprite) {
                    return true;
                }

                @Override
                public void execute(float deltaTime, Sprite sprite) {
                    fail("Removed behavior must not execute");
                }

                @Override
                public boolean remove(Sprite sprite) {
                    return true;
                }
            };
            Sprite sprite = sprite(doomed);

            sprite.update(0.1f);

            assertTrue(sprite.getBehaviors().isEmpty());
        }

        @Test
        @DisplayName("Later behaviors see what earlier ones did in the same tick")
        void inOrderVisibility() {
            List<Vector2> seen = new ArrayList<>();
            Sprite sprite = sprite(
                    new Callback((dt, s) -> s.setPosition(1, 2)),
                    new Callback((dt, s) -> seen.add(s.getPosition())));

            sprite.update(0.1f);

            assertEquals(List.of(new Vector2(1, 2)), seen);
        }

        @Test
        @DisplayName("A behavior added during the pass first runs on the next tick")
        void addedDuringPass() {
            int[] lateRuns = {0};
            Callback late = new Callback((dt, s) -> lateRuns[0]++);
            Sprite sprite = sprite(new Callback((dt, s) -> {
                if (!s.getBehaviors().contains(late)) {
                    s.addBehavior(late);
                }
            }));

            sprite.update(0.1f);
            assertEquals(0, lateRuns[0]);
            sprite.update(0.1f);
            assertEquals(1, lateRuns[0]);
        }

        @Test
        @DisplayName("Nothing runs after a behavior destroys the sprite")
        void destroyStopsPass() {
            int[] after = {0};
            Sprite sprite = sprite(
                    new Callback((dt, s) -> s.destroy()),
                    new Callback((dt, s) -> after[0]++));

            sprite.update(0.1f);

            assertEquals(0, after[0]);
        }

        @Test
        @DisplayName("A disabled sprite runs no behaviors")
        void disabledSprite() {
            int[] runs = {0};
            Sprite sprite = new Sprite(Vector2.ZERO, List.of(A),
                    NodeConfig.builder().enabled(false).build(),
                    new Callback((dt, s) -> runs[0]++));

            sprite.update(0.1f);

            assertEquals(0, runs[0]);
        }

        @Test
        @DisplayName("removeBehavior drops the first occurrence")
        void removeBehavior() {
            Callback callback = new Callback((dt, s) -> { });
            Sprite sprite = sprite(callback, callback);

            assertTrue(sprite.removeBehavior(callback));
            assertEquals(1, sprite.getBehaviors().size());
        }
    }

    @Nested
    @DisplayName("Animation and drawing")
    class Animation {

        @Test
        @DisplayName("Frame 0 on the first update, then one frame every 1/fps seconds, wrapping")
        void advancesWithTime() {
            Sprite sprite = sprite();
            assertEquals(-1, sprite.getFrame());
            assertSame(A, sprite.currentImage());

            sprite.update(0.25f);
            assertEquals(0, sprite.getFrame());
            sprite.update(0.25f);
            assertEquals(0, sprite.getFrame());
            sprite.update(0.25f);
            assertEquals(1, sprite.getFrame());
            sprite.update(0.5f);
            assertEquals(2, sprite.getFrame());
            sprite.update(0.5f);
            assertEquals(0, sprite.getFrame());
        }

        @Test
        @DisplayName("A long frame skips several images at once")
        void longFrameSkipsImages() {
            Sprite sprite = sprite();
            sprite.update(0.1f);

            sprite.update(3.5f);

            assertEquals(1, sprite.getFrame(), "7 periods over 3 images");
        }

        @Test
        @DisplayName("A huge delta after a pause returns promptly with a valid frame")
        void hugeDeltaStaysBounded() {
            Sprite sprite = sprite();
            sprite.setFps(60f);
            sprite.update(0.1f);

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> sprite.update(1_000_000f));

            assertTrue(sprite.getFrame() >= 0 && sprite.getFrame() < 3, "Frame was " + sprite.getFrame());
            assertFalse(sprite.isDestroyed());
        }

        @Test
        @DisplayName("Re-activation restarts the animation")
        void activationResets() {
            Sprite sprite = sprite();
            sprite.update(0.5f);
            sprite.update(0.5f);
            assertEquals(1, sprite.getFrame());

            sprite.setActive(false);
            sprite.setActive(true);

            assertEquals(-1, sprite.getFrame());
            assertSame(A, sprite.currentImage());
        }

        @Test
        @DisplayName("Draw blits the current image at the position, unless invisible")
        void drawsCurrentImage() {
            RecordingSurface surface = new RecordingSurface();
            Sprite sprite = sprite();

            sprite.draw(surface);
            sprite.setVisible(false);
            sprite.draw(surface);

            assertEquals(List.of("blit a @50.0,50.0"), surface.calls);
        }

        @Test
        @DisplayName("Bounds are the current image centred on the position")
        void bounds() {
            assertEquals(new Rect(45, 40, 10, 20), sprite().bounds());
        }

        @Test
        @DisplayName("Invalid construction and frame rate are rejected")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new Sprite(Vector2.ZERO, List.of()));
            Sprite sprite = sprite();
            assertThrows(IllegalArgumentException.class, () -> sprite.setFps(0f));
            sprite.setFps(10f);
            assertEquals(10f, sprite.getFps());
        }
    }
}
