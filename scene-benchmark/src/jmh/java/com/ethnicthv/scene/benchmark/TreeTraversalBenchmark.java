package com.ethnicthv.scene.benchmark;

import com.ethnicthv.scene.core.api.Colour;
import com.ethnicthv.scene.core.api.ISurface;
import com.ethnicthv.scene.core.api.SpriteImage;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.GameObject;
import com.ethnicthv.scene.core.node.NodeConfig;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * Cost of one update + draw pass over a flat (wide) tree vs a deep chain of the same size.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx2G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class TreeTraversalBenchmark {

    @State(Scope.Thread)
    public static class TreeState {
        @Param({"100", "1000", "10000"})
        public int nodeCount;

        public GameObject wide;
        public GameObject deep;
        public SinkSurface surface;

        @Setup(Level.Trial)
        public void setup() {
            surface = new SinkSurface();

            wide = new GameObject("wide");
            for (int i = 0; i < nodeCount; i++) {
                wide.addChild(counter());
            }

            // Kept under the default thread stack for the largest param
            deep = new GameObject("deep");
            GameObject tail = deep;
            int depth = Math.min(nodeCount, 2000);
            for (int i = 0; i < depth; i++) {
                tail = tail.addChild(counter());
            }
        }

        private static GameObject counter() {
            int[] ticks = new int[1];
            return new GameObject(NodeConfig.builder()
                    .onUpdate((self, dt) -> ticks[0]++)
                    .onDraw((self, s) -> s.filledCircle(Vector2.ZERO, ticks[0], Colour.WHITE))
                    .build());
        }
    }

    /** Folds every draw call into a value the benchmark returns, so nothing is dead code. */
    static final class SinkSurface implements ISurface {
        float sink;

        @Override
        public void fill(Colour colour) {
            sink += colour.red();
        }

        @Override
        public void blit(SpriteImage image, Vector2 centre) {
            sink += centre.x();
        }

        @Override
        public void filledCircle(Vector2 centre, float radius, Colour colour) {
            sink += radius;
        }

        @Override
        public void text(String text, Vector2 centre, Colour colour, float fontSize) {
            sink += text.length();
        }
    }

    // ===== Flat tree =====

    @Benchmark
    public void wide_update(TreeState s) {
        s.wide.update(1f / 60f);
    }

    @Benchmark
    public float wide_draw(TreeState s) {
        s.wide.draw(s.surface);
        return s.surface.sink;
    }

    // ===== Chain =====

    @Benchmark
    public void deep_update(TreeState s) {
        s.deep.update(1f / 60f);
    }

    @Benchmark
    public float deep_draw(TreeState s) {
        s.deep.draw(s.surface);
        return s.surface.sink;
    }
}
