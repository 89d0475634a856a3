package io.github.yok.kp.core.model;

/**
 * エネルギー E からブロッホ条件 cos(kL) = D(E) の右辺 D を返す関数です。
 *
 * <p>
 * バンド端スキャナや主波数の計算は、分散モデルの種類を意識せずこの関数だけを利用します。
 * </p>
 */
@FunctionalInterface
public interface EnergyToDispersion {

    /**
     * D(E) を返します。
     *
     * @param energy エネルギー E です
     * @return D(E) です（|D| &gt; 1 は禁制帯を表します）
     */
    double dispersion(double energy);
}
