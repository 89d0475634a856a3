package io.github.yok.kp.core.twod;

import java.util.List;
import lombok.Value;

/**
 * あるエネルギーでの k 格子全体の評価結果です。
 */
@Value
public class EnergySlice {

    /**
     * エネルギー E です。
     */
    double energy;

    /**
     * 許容帯に属する k 点の数です。
     */
    int allowedCount;

    /**
     * 各 k 点の評価結果です。
     */
    List<KPointSample> samples;
}
