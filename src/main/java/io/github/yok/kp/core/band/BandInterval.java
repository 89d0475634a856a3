package io.github.yok.kp.core.band;

import lombok.Value;

/**
 * スキャンで見つかった 1 本の許容帯 [E_lo, E_hi] です。
 */
@Value
public class BandInterval {

    /**
     * 下端エネルギー E_lo です。
     */
    double lower;

    /**
     * 上端エネルギー E_hi です。
     */
    double upper;

    /**
     * 帯の幅 E_hi - E_lo を返します。
     *
     * @return 帯幅です
     */
    public double width() {
        return upper - lower;
    }
}
