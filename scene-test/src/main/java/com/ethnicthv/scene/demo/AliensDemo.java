package com.ethnicthv.scene.demo;

import com.ethnicthv.scene.Root;

import java.util.Random;

/**
 * Runs {@link AliensScene} headless for a fixed number of frames and prints what happened.
 * The host side (pacing, input, rendering) is played by this class.
 */
public class AliensDemo {

    private static final int FRAMES = 60 * 20;
    private static final float DELTA_TIME = 1f / 60f;

    public static void main(String[] args) {
        long seed = args.length > 0 ? Long.parseLong(args[0]) : 2024L;

        ScriptedControls controls = new ScriptedControls(90);
        AliensScene scene = new AliensScene(new Random(seed), controls, true);
        CountingSurface surface = new CountingSurface();

        try (Root root = scene.root()) {
            System.out.println("Running " + FRAMES + " frames headless (seed " + seed + ")...");
            long startTime = System.nanoTime();
            for (int frame = 0; frame < FRAMES; frame++) {
                controls.tick();
                root.update(DELTA_TIME);
                root.draw(surface);
            }
            long totalTime = System.nanoTime() - startTime;

            System.out.printf("Simulated %.1f s in %.2f ms%n", FRAMES * DELTA_TIME, totalTime / 1_000_000.0);
            System.out.println("Score: " + scene.score());
            System.out.println("Aliens left: " + scene.aliens().size());
            System.out.println("Bullets in flight: " + scene.bullets().size());
            System.out.printf("Draw calls: %d blits, %d circles, %d texts%n",
                    surface.blits(), surface.circles(), surface.texts());
        }

        System.out.println("\n=== Demo Complete ===");
    }
}
