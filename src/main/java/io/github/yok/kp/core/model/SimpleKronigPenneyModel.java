package io.github.yok.kp.core.model;

import static io.github.yok.kp.core.numeric.NumericGuards.alpha;
import static io.github.yok.kp.core.numeric.NumericGuards.beta;
import static io.github.yok.kp.core.numeric.NumericGuards.gamma;
import static io.github.yok.kp.core.numeric.NumericGuards.safe;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 単純 KP モデル（障壁 + 井戸）の閉形式の分散関係です。
 *
 * <p>
 * E &lt; V0 では cos/cosh 形、E ≥ V0 では cos/cos 形を使います。
 * </p>
 *
 * <ul>
 * <li>E &lt; V0: D = cos(αb)cosh(2βa) + (α²+β²)/(2αβ) sin(αb)sinh(2βa)</li>
 * <li>E ≥ V0: D = cos(αb)cos(2γa) - (γ²-α²)/(2αγ) sin(αb)sin(2γa)</li>
 * </ul>
 *
 * <p>
 * ガード前の α と β（または γ）のどちらかがちょうど 0 の場合は D = 1.0 を返します。 E ≈ 0 と E ≈ V0 の境界は許容帯側の値に固定されます。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public final class SimpleKronigPenneyModel implements DispersionRelation {

    /**
     * 境界で返す D の値です。
     */
    static final double BOUNDARY_DISPERSION = 1.0;

    /**
     * モデルパラメータです。
     */
    private final SimpleKpParameters parameters;

    @Override
    public double dispersion(double energy) {
        return dispersion(energy, parameters);
    }

    @Override
    public double period() {
        return parameters.period();
    }

    /**
     * 指定パラメータで D(E) を評価します。
     *
     * @param energy エネルギー E です
     * @param p パラメータです
     * @return D(E) です
     */
    public static double dispersion(double energy, SimpleKpParameters p) {
        double a = p.getA();
        double b = p.getB();
        double v0 = p.getV0();
        double mu = p.getMu();

        double alphaRaw = alpha(energy, mu);

        if (energy < v0) {
            double betaRaw = beta(v0, energy, mu);
            if (alphaRaw == 0.0 || betaRaw == 0.0) {
                return BOUNDARY_DISPERSION;
            }
            double al = safe(alphaRaw);
            double be = safe(betaRaw);
            double coef = (al * al + be * be) / (2.0 * al * be);
            return Math.cos(al * b) * Math.cosh(2.0 * be * a)
                    + coef * Math.sin(al * b) * Math.sinh(2.0 * be * a);
        }

        double gammaRaw = gamma(energy, v0, mu);
        if (alphaRaw == 0.0 || gammaRaw == 0.0) {
            return BOUNDARY_DISPERSION;
        }
        double al = safe(alphaRaw);
        double ga = safe(gammaRaw);
        double coef = (ga * ga - al * al) / (2.0 * al * ga);
        return Math.cos(al * b) * Math.cos(2.0 * ga * a)
                - coef * Math.sin(al * b) * Math.sin(2.0 * ga * a);
    }
}
