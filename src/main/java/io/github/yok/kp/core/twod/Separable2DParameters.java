package io.github.yok.kp.core.twod;

import io.github.yok.kp.core.model.SimpleKpParameters;
import lombok.Value;

/**
 * 分離型 2 次元 KP モデルのパラメータです。
 *
 * <p>
 * 各軸の格子定数 Lx, Ly と、両軸で共通の 1 次元因子 (a, b, V0, mu) を持ちます。
 * </p>
 */
@Value
public class Separable2DParameters {

    /**
     * x 方向の格子定数です。
     */
    double lx;

    /**
     * y 方向の格子定数です。
     */
    double ly;

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
     * 各軸で共有する 1 次元 KP のパラメータを返します。
     *
     * @return 1 次元パラメータです
     */
    public SimpleKpParameters axisParameters() {
        return new SimpleKpParameters(a, b, v0, mu);
    }
}
