package io.github.yok.kp.core.model;

import lombok.Value;

/**
 * 1 つのエネルギーでの (E, D, 許容判定, 主波数) の組です。
 */
@Value
public class DispersionSample {

    double energy;

    /**
     * D(E) です。
     */
    double d;

    boolean allowed;

    /**
     * 主波数 k（≥ 0）です。
     */
    double k;

    /**
     * モデルを E で評価して標本を作ります。
     *
     * @param relation 分散モデルです
     * @param energy エネルギー E です
     * @return 標本です
     */
    public static DispersionSample of(DispersionRelation relation, double energy) {
        double d = relation.dispersion(energy);
        return new DispersionSample(energy, d, BlochCondition.isAllowed(d),
                BlochCondition.principalK(d, relation.period()));
    }

    /**
     * -k を返します。
     *
     * @return 負側の波数です
     */
    public double kMinus() {
        return -k;
    }

    /**
     * +k を返します。
     *
     * @return 正側の波数です
     */
    public double kPlus() {
        return k;
    }
}
