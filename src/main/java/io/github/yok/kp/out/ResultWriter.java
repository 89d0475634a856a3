package io.github.yok.kp.out;

import io.github.yok.kp.app.KpProperties;
import io.github.yok.kp.core.band.BandInterval;
import io.github.yok.kp.core.model.DispersionSample;
import io.github.yok.kp.core.twod.KPointSample;
import java.util.List;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 出力の命名規約に使うため、計算したモデルの種類を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * エネルギーごとの分散標本（E, D, allowed, k_minus, k_plus）を出力します。
     *
     * @param variant モデルの種類です
     * @param samples 分散標本です（エネルギー昇順）
     */
    void writeDispersion(KpProperties.Model.Variant variant, List<DispersionSample> samples);

    /**
     * 許容帯の一覧（E_lo, E_hi）を出力します。
     *
     * @param variant モデルの種類です
     * @param bands 許容帯です
     */
    void writeBands(KpProperties.Model.Variant variant, List<BandInterval> bands);

    /**
     * k 空間の評価結果（kx, ky, D, E, allowed）を出力します。
     *
     * @param variant モデルの種類です
     * @param samples k 点ごとの評価結果です
     * @param energies 各 k 点のエネルギー面 E(kx, ky) です（samples と同じ長さ）
     */
    void writeKSpace(KpProperties.Model.Variant variant, List<KPointSample> samples,
            double[] energies);
}
