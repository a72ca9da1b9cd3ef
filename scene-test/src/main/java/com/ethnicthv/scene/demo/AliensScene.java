package com.ethnicthv.scene.demo;

import com.ethnicthv.scene.Root;
import com.ethnicthv.scene.core.api.Colour;
import com.ethnicthv.scene.core.api.IControls;
import com.ethnicthv.scene.core.api.SpriteImage;
import com.ethnicthv.scene.core.behavior.CalculatedPosition;
import com.ethnicthv.scene.core.behavior.Callback;
import com.ethnicthv.scene.core.behavior.Exactly;
import com.ethnicthv.scene.core.behavior.Move;
import com.ethnicthv.scene.core.behavior.MovePlayer;
import com.ethnicthv.scene.core.behavior.OverridePosition;
import com.ethnicthv.scene.core.behavior.RelativeToNow;
import com.ethnicthv.scene.core.behavior.RemoveWhenFinished;
import com.ethnicthv.scene.core.behavior.ReturnToNormalPosition;
import com.ethnicthv.scene.core.behavior.Sequence;
import com.ethnicthv.scene.core.behavior.Whilst;
import com.ethnicthv.scene.core.math.Vector2;
import com.ethnicthv.scene.core.node.GameObject;
import com.ethnicthv.scene.core.sprite.Sprite;
import com.ethnicthv.scene.core.sprite.SpriteCollisions;
import com.ethnicthv.scene.particles.ParticleExplosion;
import com.ethnicthv.scene.particles.ParticleScore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * A small shoot-'em-up wired together from the engine's public API: a starfield,
 * a swaying alien formation whose bottom row dives, a player ship, bullets, collision
 * rules and particle effects.
 */
public final class AliensScene {

    private static final Logger LOGGER = LogManager.getLogger(AliensScene.class);

    public static final float WIDTH = 600f;
    public static final float HEIGHT = 700f;

    static final int ROWS = 3;
    static final int COLUMNS = 6;
    static final int POINTS_PER_ALIEN = 10;
    static final float FIRE_INTERVAL = 0.25f;
    static final float BULLET_SPEED = 400f;

    private static final List<SpriteImage> ALIEN_IMAGES = List.of(
            new SpriteImage("alien_1", 40, 30), new SpriteImage("alien_2", 40, 30));
    private static final List<SpriteImage> PLAYER_IMAGES = List.of(new SpriteImage("player", 50, 40));
    private static final List<SpriteImage> BULLET_IMAGES = List.of(new SpriteImage("bullet", 4, 12));

    private final RandomGenerator random;
    private final Root root;
    private final GameObject aliens = new GameObject("aliens");
    private final GameObject bullets = new GameObject("bullets");
    private final GameObject effects = new GameObject("effects");
    private final Sprite player;
    private float fireCooldown;
    private int score;

    /**
     * @param autoFire when true the player shoots every {@value #FIRE_INTERVAL} seconds
     */
    public AliensScene(RandomGenerator random, IControls controls, boolean autoFire) {
        this.random = random;

        player = new Sprite(new Vector2(WIDTH / 2, HEIGHT - 50), PLAYER_IMAGES,
                new MovePlayer(controls, 200f, 25f, WIDTH - 25f));

        for (int row = 0; row < ROWS; row++) {
            for (int column = 0; column < COLUMNS; column++) {
                aliens.addChild(createAlien(row, column));
            }
        }

        SpriteCollisions collisions = new SpriteCollisions();
        collisions.addDetection(
                () -> bullets.childrenOfType(Sprite.class),
                () -> aliens.childrenOfType(Sprite.class),
                this::onAlienHit);

        Root.Builder builder = Root.builder()
                .backgroundColour(Colour.BLACK)
                .addGameObject(Starfield.create(WIDTH, HEIGHT, random))
                .addGameObject(aliens)
                .addGameObject(player)
                .addGameObject(bullets)
                .addGameObject(effects)
                .addGameObject(collisions)
                .addDrawFunc(surface -> surface.text("SCORE " + score, new Vector2(60, 20), Colour.YELLOW, 24f));
        if (autoFire) {
            builder.addUpdateFunc(this::autoFire);
        }
        this.root = builder.build();
    }

    private Sprite createAlien(int row, int column) {
        Vector2 slot = new Vector2(150f + column * 60f, 100f + row * 50f);
        Sprite alien = new Sprite(slot, ALIEN_IMAGES,
                new RelativeToNow(new CalculatedPosition(t -> 40 * Math.sin(t), t -> 0)));

        if (row == ROWS - 1) {
            // Follow the slot for a while, dive, then fly back into it.
            int waitTicks = Math.round((1f + column * 0.5f) * 60);
            alien.addBehavior(new OverridePosition(new Sequence(
                    new Whilst(
                            new Exactly(waitTicks, new Callback((dt, s) -> { })),
                            new ReturnToNormalPosition(new Vector2(1000, 1000))),
                    new Move(new Vector2(0, 150), new Vector2(0, 120)),
                    new ReturnToNormalPosition(new Vector2(120, 120)))));
        }
        return alien;
    }

    private void autoFire(float deltaTime) {
        fireCooldown -= deltaTime;
        if (fireCooldown <= 0f) {
            fireCooldown += FIRE_INTERVAL;
            fireBullet(player.getPosition());
        }
    }

    /** Spawns a bullet at {@code from} travelling up off the screen. */
    public Sprite fireBullet(Vector2 from) {
        Sprite bullet = new Sprite(from, BULLET_IMAGES,
                new RemoveWhenFinished(new Move(new Vector2(0, -HEIGHT), new Vector2(0, BULLET_SPEED))));
        bullet.setLifetime(HEIGHT / BULLET_SPEED);
        return bullets.addChild(bullet);
    }

    private void onAlienHit(Sprite bullet, Sprite alien) {
        bullet.destroy();
        alien.destroy();
        score += POINTS_PER_ALIEN;
        LOGGER.debug("{} hit {} at {}, score {}", bullet, alien, alien.getPosition(), score);

        effects.addChild(new ParticleExplosion(alien.getPosition(), 1.5f, Colour.CYAN, 40, random));
        effects.addChild(new ParticleScore(alien.getPosition(), 1f, POINTS_PER_ALIEN, random));
    }

    public Root root() {
        return root;
    }

    public Sprite player() {
        return player;
    }

    public List<Sprite> aliens() {
        return aliens.childrenOfType(Sprite.class);
    }

    public List<Sprite> bullets() {
        return bullets.childrenOfType(Sprite.class);
    }

    public List<GameObject> effects() {
        return effects.getChildren();
    }

    public int score() {
        return score;
    }
}
