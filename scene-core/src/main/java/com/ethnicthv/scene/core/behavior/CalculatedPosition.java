package com.ethnicthv.scene.core.behavior;

import com.ethnicthv.scene.core.sprite.Sprite;

import java.util.function.DoubleUnaryOperator;

/**
 * Places the sprite on a parametric trajectory: each tick the elapsed time is advanced
 * and every supplied function maps it to a coordinate. An axis without a function keeps
 * its current value.
 * <p>
 * Usually wrapped in {@link RelativeToNow} so the functions can be written around the origin.
 */
public final class CalculatedPosition extends BaseBehavior {

    private final DoubleUnaryOperator xFunction;
    private final DoubleUnaryOperator yFunction;
    private float elapsed;

    /**
     * @param xFunction elapsed seconds to x, or null to leave x alone
     * @param yFunction elapsed seconds to y, or null to leave y alone
     */
    public CalculatedPosition(DoubleUnaryOperator xFunction, DoubleUnaryOperator yFunction) {
        if (xFunction == null && yFunction == null) {
            throw new IllegalArgumentException("At least one of xFunction / yFunction is required");
        }
        this.xFunction = xFunction;
        this.yFunction = yFunction;
    }

    public static CalculatedPosition x(DoubleUnaryOperator xFunction) {
        return new CalculatedPosition(xFunction, null);
    }

    public static CalculatedPosition y(DoubleUnaryOperator yFunction) {
        return new CalculatedPosition(null, yFunction);
    }

    @Override
    public void execute(float deltaTime, Sprite sprite) {
        elapsed += deltaTime;

        float x = sprite.getPosition().x();
        float y = sprite.getPosition().y();
        if (xFunction != null) {
            x = (float) xFunction.applyAsDouble(elapsed);
        }
        if (yFunction != null) {
            y = (float) yFunction.applyAsDouble(elapsed);
        }
        sprite.setPosition(x, y);
    }

    public float elapsed() {
        return elapsed;
    }
}
