package io.github.yok.kp.core.model;

import lombok.Value;

/**
 * 単純 KP モデル（障壁 + 井戸の 2 領域）のパラメータです。
 *
 * <p>
 * 障壁（幅 2a、高さ V0）を原点中心に置き、その両側に幅 b の井戸が付きます。周期は L = 2a + 2b です。
 * </p>
 */
@Value
public class SimpleKpParameters {

    /**
     * 障壁の半幅 a です。
     */
    double a;

    /**
     * 片側の井戸幅 b です。
     */
    double b;

    /**
     * 障壁の高さ V0 です。
     */
    double v0;

    /**
     * 質量スケール mu = ħ²/2m です。
     */
    double mu;

    /**
     * mu = 1.0 でパラメータを生成します。
     *
     * @param a 障壁の半幅です
     * @param b 片側の井戸幅です
     * @param v0 障壁の高さです
     * @return パラメータです
     */
    public static SimpleKpParameters of(double a, double b, double v0) {
        return new SimpleKpParameters(a, b, v0, 1.0);
    }

    /**
     * 周期 L = 2a + 2b を返します。
     *
     * @return 周期です
     */
    public double period() {
        return 2.0 * a + 2.0 * b;
    }
}
