package io.github.yok.kp.core.twod;

import lombok.Value;

/**
 * 有効質量テンソル（2×2 対称）の成分です。
 *
 * <p>
 * 分離型ポテンシャルでは非対角成分 xy は 0 です。曲率が 0 の成分は +∞ になります。
 * </p>
 */
@Value
public class EffectiveMassTensor {

    double xx;

    double yy;

    double xy;
}
