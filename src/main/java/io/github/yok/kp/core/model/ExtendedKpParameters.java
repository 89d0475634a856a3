package io.github.yok.kp.core.model;

import lombok.Value;

/**
 * 拡張 KP モデル（U1 障壁 - 井戸 - U2 障壁 - 井戸）のパラメータです。
 *
 * <p>
 * U2 ≥ U1 は呼び出し側で保証します。周期は L = 4a + 4b です。
 * </p>
 */
@Value
public class ExtendedKpParameters {

    /**
     * 障壁の半幅 a です（各障壁の幅は 2a）。
     */
    double a;

    /**
     * 井戸の半幅 b です（各井戸の幅は 2b）。
     */
    double b;

    /**
     * 1 つ目の障壁の高さです。
     */
    double u1;

    /**
     * 2 つ目の障壁の高さです。
     */
    double u2;

    /**
     * 質量スケール mu = ħ²/2m です。
     */
    double mu;

    /**
     * 周期 L = 4a + 4b を返します。
     *
     * @return 周期です
     */
    public double period() {
        return 4.0 * a + 4.0 * b;
    }
}
