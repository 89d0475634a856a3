package io.github.yok.kp.core.model;

import io.github.yok.kp.core.numeric.NumericGuards;

/**
 * ブロッホ条件 cos(kL) = D に関する判定と主波数の計算です。
 */
public final class BlochCondition {

    /**
     * 許容帯判定で |D| ≤ 1 に加える余裕です。
     *
     * <p>
     * ちょうどバンド端の点を浮動小数点誤差で禁制扱いしないための値です。
     * </p>
     */
    public static final double ALLOWED_SLACK = 1.0e-7;

    private BlochCondition() {
    }

    /**
     * D が許容帯の値かを返します。
     *
     * @param d ブロッホ条件の右辺です
     * @return |D| ≤ 1 + {@value #ALLOWED_SLACK} なら true です
     */
    public static boolean isAllowed(double d) {
        return Math.abs(d) <= 1.0 + ALLOWED_SLACK;
    }

    /**
     * 外部から与えた周期 L に対する主波数 acos(clamp(D, -1, 1)) / L を返します。
     *
     * @param d ブロッホ条件の右辺です
     * @param period 周期 L です
     * @return [0, π/L] の波数です
     */
    public static double principalK(double d, double period) {
        return Math.acos(NumericGuards.clamp(d, -1.0, 1.0)) / period;
    }
}
