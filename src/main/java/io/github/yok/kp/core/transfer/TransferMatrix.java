package io.github.yok.kp.core.transfer;

import io.github.yok.kp.core.numeric.NumericGuards;
import java.util.List;
import lombok.Value;
import org.ejml.data.DMatrix2x2;
import org.ejml.dense.fixed.CommonOps_DDF2;

/**
 * 波動関数とその微分 (ψ, ψ') を層の一端から他端へ写す 2×2 転送行列です。
 *
 * <p>
 * 積は非可換のため、層の並び順どおり左から右へ合成します。 積とトレースの計算には EJML の固定サイズ演算を使います。
 * </p>
 */
@Value
public class TransferMatrix {

    /**
     * 単位行列です（合成の初期値）。
     */
    public static final TransferMatrix IDENTITY = new TransferMatrix(1.0, 0.0, 0.0, 1.0);

    double m11;
    double m12;
    double m21;
    double m22;

    /**
     * 1 層分の転送行列を返します。
     *
     * <ul>
     * <li>E &gt; V（振動解）: k=sqrt((E-V)/mu) として [[cos kw, sin kw / k], [-k sin kw, cos kw]]</li>
     * <li>E ≤ V（減衰解）: κ=sqrt((V-E)/mu) として [[cosh κw, sinh κw / κ], [κ sinh κw, cosh κw]]</li>
     * </ul>
     *
     * <p>
     * k, κ は {@link NumericGuards#safe(double)} を通すため、E=V のちょうど近傍では極限値の近似になります。
     * </p>
     *
     * @param energy エネルギー E です
     * @param potential 層のポテンシャル V です
     * @param width 層の幅 w です
     * @param mu 質量スケール ħ²/2m です
     * @return 転送行列です
     */
    public static TransferMatrix ofLayer(double energy, double potential, double width, double mu) {
        double m = Math.max(mu, NumericGuards.MU_FLOOR);
        double d = energy - potential;
        if (d > 0.0) {
            double k = NumericGuards.safe(Math.sqrt(d / m));
            double kw = k * width;
            double c = Math.cos(kw);
            double s = Math.sin(kw);
            return new TransferMatrix(c, s / k, -k * s, c);
        }
        double kappa = NumericGuards.safe(Math.sqrt(-d / m));
        double kw = kappa * width;
        double ch = Math.cosh(kw);
        double sh = Math.sinh(kw);
        return new TransferMatrix(ch, sh / kappa, kappa * sh, ch);
    }

    /**
     * 1 層分の転送行列を返します。
     *
     * @param energy エネルギー E です
     * @param layer 層です
     * @param mu 質量スケール ħ²/2m です
     * @return 転送行列です
     */
    public static TransferMatrix ofLayer(double energy, Layer layer, double mu) {
        return ofLayer(energy, layer.getPotential(), layer.getWidth(), mu);
    }

    /**
     * 層列の転送行列を単位行列から順に合成します。
     *
     * @param energy エネルギー E です
     * @param layers 層列です（伝搬順）
     * @param mu 質量スケール ħ²/2m です
     * @return 合成した転送行列です
     */
    public static TransferMatrix ofStack(double energy, List<Layer> layers, double mu) {
        TransferMatrix total = IDENTITY;
        for (Layer layer : layers) {
            total = total.multiply(ofLayer(energy, layer, mu));
        }
        return total;
    }

    /**
     * this × other を返します。
     *
     * @param other 右側から掛ける行列です
     * @return 積です
     */
    public TransferMatrix multiply(TransferMatrix other) {
        DMatrix2x2 product = new DMatrix2x2();
        CommonOps_DDF2.mult(toEjml(), other.toEjml(), product);
        return fromEjml(product);
    }

    /**
     * トレース m11 + m22 を返します。
     *
     * @return トレースです
     */
    public double trace() {
        return CommonOps_DDF2.trace(toEjml());
    }

    /**
     * ブロッホ条件の右辺 D = Tr(M)/2 を返します。
     *
     * @return トレースの半分です
     */
    public double halfTrace() {
        return 0.5 * trace();
    }

    /**
     * 行列式を返します。
     *
     * @return 行列式です
     */
    public double determinant() {
        return CommonOps_DDF2.det(toEjml());
    }

    private DMatrix2x2 toEjml() {
        return new DMatrix2x2(m11, m12, m21, m22);
    }

    private static TransferMatrix fromEjml(DMatrix2x2 m) {
        return new TransferMatrix(m.a11, m.a12, m.a21, m.a22);
    }
}
