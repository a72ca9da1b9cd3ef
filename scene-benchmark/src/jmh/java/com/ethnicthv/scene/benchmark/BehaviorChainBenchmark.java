package com.ethnicthv.scene.benchmark;

import com.ethnicthv.scene.core.api.SpriteImage;
import com.ethnicthv.scene.core.behavior.CalculatedPosition;
import com.ethnicthv.scene.core.behavior.Move;
import com.ethnicthv.scene.core.behavior.OverridePosition;
import com.ethnicthv.scene.core.behavior.RelativeToNow;
import com.ethnicthv.scene.core.behavior.ReturnToNormalPosition;
import com.ethnicthv.scene.core.behavior.Sequence;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.GameObject;
import com.ethnicthv.scene.core.sprite.Sprite;
import com.ethnicthv.scene.core.sprite.SpriteCollisions;
import org.openjdk.jmh.annotations.*;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Per-frame cost of sprites running a formation + dive behavior stack, and of a
 * group-vs-group collision rule over the same sprites.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx2G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class BehaviorChainBenchmark {

    private static final List<SpriteImage> IMAGES = List.of(new SpriteImage("bench", 16, 16));

    @State(Scope.Thread)
    public static class SpriteState {
        @Param({"100", "1000"})
        public int spriteCount;

        public GameObject group;
        public GameObject others;
        public SpriteCollisions collisions;
        public int hits;

        // Fresh behaviors every iteration so the dive is not already finished
        @Setup(Level.Iteration)
        public void setup() {
            group = new GameObject("formation");
            others = new GameObject("others");
            for (int i = 0; i < spriteCount; i++) {
                Vector2 slot = new Vector2((i % 50) * 20f, (i / 50) * 20f);
                group.addChild(new Sprite(slot, IMAGES,
                        new RelativeToNow(new CalculatedPosition(t -> 40 * Math.sin(t), t -> 0)),
                        new OverridePosition(new Sequence(
                                new Move(new Vector2(0, 10_000), new Vector2(0, 120)),
                                new ReturnToNormalPosition(new Vector2(120, 120))))));
                others.addChild(new Sprite(slot.plus(8, 8), IMAGES));
            }

            hits = 0;
            collisions = new SpriteCollisions();
            collisions.addDetection(
                    () -> group.childrenOfType(Sprite.class),
                    () -> others.childrenOfType(Sprite.class),
                    (a, b) -> hits++);
        }
    }

    @Benchmark
    public void behaviors_update(SpriteState s) {
        s.group.update(1f / 60f);
    }

    @Benchmark
    public int collisions_update(SpriteState s) {
        s.collisions.update(1f / 60f);
        return s.hits;
    }
}
