package io.github.yok.kp.core.twod;

import lombok.Value;

/**
 * 2 次元波数ベクトル (kx, ky) です。
 */
@Value
public class WaveVector2D {

    double kx;

    double ky;

    /**
     * |k| = sqrt(kx² + ky²) を返します。
     *
     * @return 波数ベクトルの大きさです
     */
    public double magnitude() {
        return Math.sqrt(kx * kx + ky * ky);
    }
}
