package io.github.yok.kp.core.twod;

import lombok.Value;

/**
 * 固定エネルギーでの k 点 1 つ分の評価結果です。
 */
@Value
public class KPointSample {

    double kx;

    double ky;

    /**
     * D(E, kx, ky) です。
     */
    double d;

    /**
     * 許容帯かどうかです。
     */
    boolean allowed;

    /**
     * |k| です。
     */
    double kMagnitude;
}
