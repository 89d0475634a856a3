package io.github.yok.kp.core.model;

import io.github.yok.kp.core.transfer.Layer;
import java.util.List;
import lombok.Getter;

/**
 * 拡張 KP モデル（U1 障壁 - 井戸 - U2 障壁 - 井戸）の分散関係です。
 *
 * <p>
 * U1 = U2 のときは V0 = U1 の単純 KP の式をそのまま使います。 U1 ≠ U2 のときは 4 層 [(2a,U1), (2b,0), (2a,U2),
 * (2b,0)] の転送行列から D を求めます。 周期はどちらの場合も L = 4a + 4b です。
 * </p>
 */
@Getter
public final class ExtendedKronigPenneyModel implements DispersionRelation {

    /**
     * モデルパラメータです。
     */
    private final ExtendedKpParameters parameters;

    /**
     * U1 = U2 のときに使う単純 KP のパラメータです（それ以外は null）。
     */
    private final SimpleKpParameters degenerateParameters;

    /**
     * U1 ≠ U2 のときに使う 4 層モデルです（それ以外は null）。
     */
    private final MultilayerKronigPenneyModel stack;

    /**
     * 拡張 KP モデルを生成します。
     *
     * @param parameters パラメータです
     */
    public ExtendedKronigPenneyModel(ExtendedKpParameters parameters) {
        this.parameters = parameters;
        double a = parameters.getA();
        double b = parameters.getB();
        if (parameters.getU1() == parameters.getU2()) {
            this.degenerateParameters =
                    new SimpleKpParameters(a, b, parameters.getU1(), parameters.getMu());
            this.stack = null;
        } else {
            this.degenerateParameters = null;
            this.stack = new MultilayerKronigPenneyModel(List.of(
                    new Layer(2.0 * a, parameters.getU1()),
                    Layer.well(2.0 * b),
                    new Layer(2.0 * a, parameters.getU2()),
                    Layer.well(2.0 * b)), parameters.getMu());
        }
    }

    @Override
    public double dispersion(double energy) {
        if (stack == null) {
            return SimpleKronigPenneyModel.dispersion(energy, degenerateParameters);
        }
        return stack.dispersion(energy);
    }

    @Override
    public double period() {
        return parameters.period();
    }
}
