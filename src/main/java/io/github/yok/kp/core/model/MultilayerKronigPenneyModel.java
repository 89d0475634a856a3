package io.github.yok.kp.core.model;

import com.google.common.collect.ImmutableList;
import io.github.yok.kp.core.transfer.Layer;
import io.github.yok.kp.core.transfer.TransferMatrix;
import java.util.List;
import lombok.Getter;

/**
 * 任意の層列からなる単位胞の分散関係を転送行列で計算するクラスです。
 *
 * <p>
 * D(E) = Tr(M_total)/2、L = 層幅の総和です。層列は生成時に不変リストへ複製します。
 * </p>
 */
@Getter
public final class MultilayerKronigPenneyModel implements DispersionRelation {

    /**
     * 層列（伝搬順）です。
     */
    private final ImmutableList<Layer> layers;

    /**
     * 質量スケール mu = ħ²/2m です。
     */
    private final double mu;

    /**
     * 周期（層幅の総和）です。
     */
    private final double period;

    /**
     * 多層モデルを生成します。
     *
     * @param layers 層列です（順序は伝搬方向）
     * @param mu 質量スケールです
     */
    public MultilayerKronigPenneyModel(List<Layer> layers, double mu) {
        this.layers = ImmutableList.copyOf(layers);
        this.mu = mu;
        double total = 0.0;
        for (Layer layer : this.layers) {
            total += layer.getWidth();
        }
        this.period = total;
    }

    @Override
    public double dispersion(double energy) {
        return transferMatrix(energy).halfTrace();
    }

    @Override
    public double period() {
        return period;
    }

    /**
     * 単位胞全体の転送行列を返します。
     *
     * @param energy エネルギー E です
     * @return 合成した転送行列です
     */
    public TransferMatrix transferMatrix(double energy) {
        return TransferMatrix.ofStack(energy, layers, mu);
    }
}
