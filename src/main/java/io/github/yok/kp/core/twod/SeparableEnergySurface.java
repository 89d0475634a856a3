package io.github.yok.kp.core.twod;

import io.github.yok.kp.core.model.SimpleKpParameters;
import io.github.yok.kp.core.model.SimpleKronigPenneyModel;
import io.github.yok.kp.core.numeric.BisectionRootFinder;
import lombok.Getter;

/**
 * 分離型ポテンシャルのエネルギー面 E(kx, ky) = Ex(kx) + Ey(ky) を求めるクラスです。
 *
 * <p>
 * 各軸で D_axis(E) = cos(k L_axis) を満たす E を [0, 2·V0_axis] 上の二分法で求めます。 L_axis は格子定数 Lx, Ly で、
 * 単位胞の幅 2a+2b ではありません（k 格子と同じ周期を使います）。
 * 区間内で符号反転しない場合も二分法は区間内の値を返します。
 * </p>
 */
@Getter
public final class SeparableEnergySurface {

    /**
     * 二分法の許容誤差です。
     */
    static final double TOLERANCE = 1.0e-8;

    /**
     * 二分法の最大反復回数です。
     */
    static final int MAX_ITERATIONS = 64;

    /**
     * x 軸の 1 次元パラメータです。
     */
    private final SimpleKpParameters xAxis;

    /**
     * x 方向の格子定数です。
     */
    private final double lx;

    /**
     * y 軸の 1 次元パラメータです。
     */
    private final SimpleKpParameters yAxis;

    /**
     * y 方向の格子定数です。
     */
    private final double ly;

    private final BisectionRootFinder rootFinder =
            new BisectionRootFinder(TOLERANCE, MAX_ITERATIONS);

    /**
     * 軸ごとのパラメータを指定してエネルギー面を生成します。
     *
     * @param xAxis x 軸のパラメータです
     * @param lx x 方向の格子定数です
     * @param yAxis y 軸のパラメータです
     * @param ly y 方向の格子定数です
     */
    public SeparableEnergySurface(SimpleKpParameters xAxis, double lx, SimpleKpParameters yAxis,
            double ly) {
        this.xAxis = xAxis;
        this.lx = lx;
        this.yAxis = yAxis;
        this.ly = ly;
    }

    /**
     * 両軸で形状が等しい 2 次元モデルからエネルギー面を生成します。
     *
     * @param parameters 2 次元パラメータです
     * @return エネルギー面です
     */
    public static SeparableEnergySurface of(Separable2DParameters parameters) {
        SimpleKpParameters axis = parameters.axisParameters();
        return new SeparableEnergySurface(axis, parameters.getLx(), axis, parameters.getLy());
    }

    /**
     * E(kx, ky) = Ex(kx) + Ey(ky) を返します。
     *
     * @param kx 波数の x 成分です
     * @param ky 波数の y 成分です
     * @return エネルギーです
     */
    public double energyAt(double kx, double ky) {
        return axisEnergy(kx, xAxis, lx) + axisEnergy(ky, yAxis, ly);
    }

    /**
     * 1 軸について D(E) = cos(kL) を満たす E を返します。
     *
     * @param k 波数です
     * @param axis 軸のパラメータです
     * @param lattice 軸方向の格子定数 L です
     * @return エネルギーです
     */
    double axisEnergy(double k, SimpleKpParameters axis, double lattice) {
        double target = Math.cos(k * lattice);
        return rootFinder.findRoot(e -> SimpleKronigPenneyModel.dispersion(e, axis) - target, 0.0,
                2.0 * axis.getV0());
    }
}
