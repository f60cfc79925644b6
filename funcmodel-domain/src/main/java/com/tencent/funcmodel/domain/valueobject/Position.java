package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;
import lombok.EqualsAndHashCode;

/**
 * Position - 画布坐标
 * <p>
 * 画布是无限的，坐标可以为负，但必须是有限数值。
 * </p>
 */
@EqualsAndHashCode
public final class Position {

    private static final Position ORIGIN = new Position(0, 0);

    private final double x;
    private final double y;

    private Position(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public static Result<Position> create(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            return Result.fail("Position coordinates must be finite numbers");
        }
        return Result.ok(new Position(x, y));
    }

    public static Position origin() {
        return ORIGIN;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public Result<Position> moveBy(double dx, double dy) {
        return create(x + dx, y + dy);
    }

    public double distanceTo(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    @Override
    public String toString() {
        return "{x=" + x + ", y=" + y + "}";
    }
}
