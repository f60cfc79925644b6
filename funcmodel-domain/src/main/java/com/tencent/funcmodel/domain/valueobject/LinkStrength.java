package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;
import lombok.EqualsAndHashCode;

/**
 * LinkStrength - 连线权重，取值 [0, 1]
 */
@EqualsAndHashCode
public final class LinkStrength {

    private static final LinkStrength FULL = new LinkStrength(1.0);

    private final double value;

    private LinkStrength(double value) {
        this.value = value;
    }

    public static Result<LinkStrength> create(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            return Result.fail("Link strength must be between 0 and 1");
        }
        return Result.ok(new LinkStrength(value));
    }

    public static LinkStrength full() {
        return FULL;
    }

    public double getValue() {
        return value;
    }

    public boolean isStrong() {
        return value >= 0.7;
    }

    public boolean isWeak() {
        return value <= 0.3;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
