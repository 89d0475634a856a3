package io.github.yok.kp.core.band;

/**
 * 等間隔のエネルギー格子を生成します。
 */
public final class EnergyGrid {

    private EnergyGrid() {
    }

    /**
     * [eMin, eMax] を steps 等分した steps+1 点を昇順で返します。
     *
     * <p>
     * i 番目の点は eMin + i * (eMax - eMin) / steps です。
     * </p>
     *
     * @param eMin 下端です
     * @param eMax 上端です
     * @param steps 分割数です（1 以上）
     * @return エネルギー点の配列です
     */
    public static double[] uniform(double eMin, double eMax, int steps) {
        double step = (eMax - eMin) / steps;
        double[] energies = new double[steps + 1];
        for (int i = 0; i <= steps; i++) {
            energies[i] = eMin + i * step;
        }
        return energies;
    }
}
