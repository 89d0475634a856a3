package io.github.yok.kp.core.twod;

import io.github.yok.kp.core.model.BlochCondition;
import io.github.yok.kp.core.model.SimpleKronigPenneyModel;
import io.github.yok.kp.core.numeric.NumericGuards;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.Getter;

/**
 * 分離型ポテンシャル V(x,y) = Vx(x) + Vy(y) を仮定した 2 次元 KP モデルです。
 *
 * <p>
 * 両軸の形状が同じ正方格子の近似として、D2d(E, kx, ky) は 1 次元の D1d(E) をそのまま返します。 Dx·Dy の積は取りません
 * （Dx = Dy = D1d として扱います）。一般の 2 軸解ではありません。
 * </p>
 */
@Getter
public final class SeparableKronigPenney2D {

    /**
     * 有効質量の数値微分に使う k の刻みです。
     */
    public static final double CURVATURE_STEP = 1.0e-6;

    /**
     * {@link #scanEnergySlices} のエネルギー分割数です。
     */
    public static final int ENERGY_SLICE_DIVISIONS = 100;

    /**
     * モデルパラメータです。
     */
    private final Separable2DParameters parameters;

    /**
     * 各軸で共有する 1 次元因子です。
     */
    private final SimpleKronigPenneyModel axisModel;

    /**
     * 2 次元モデルを生成します。
     *
     * @param parameters パラメータです
     */
    public SeparableKronigPenney2D(Separable2DParameters parameters) {
        this.parameters = parameters;
        this.axisModel = new SimpleKronigPenneyModel(parameters.axisParameters());
    }

    /**
     * D2d(E, kx, ky) を返します。
     *
     * @param energy エネルギー E です
     * @param kx 波数の x 成分です
     * @param ky 波数の y 成分です
     * @return D2d です（現状は D1d(E) に等しい）
     */
    public double dispersion(double energy, double kx, double ky) {
        return axisModel.dispersion(energy);
    }

    /**
     * (E, kx, ky) が許容帯に属するかを返します。
     *
     * @param energy エネルギー E です
     * @param kx 波数の x 成分です
     * @param ky 波数の y 成分です
     * @return |D2d| ≤ 1 + 1e-7 なら true です
     */
    public boolean isAllowed(double energy, double kx, double ky) {
        return BlochCondition.isAllowed(dispersion(energy, kx, ky));
    }

    /**
     * cos(kx Lx) = Dx, cos(ky Ly) = Dy を各軸独立に解いて主波数を返します。
     *
     * @param energy エネルギー E です
     * @return 主波数です。Dx または Dy が許容帯の外なら空です
     */
    public Optional<WaveVector2D> principalK(double energy) {
        double dx = axisModel.dispersion(energy);
        double dy = dx;
        if (!BlochCondition.isAllowed(dx) || !BlochCondition.isAllowed(dy)) {
            return Optional.empty();
        }
        double kx = Math.acos(NumericGuards.clamp(dx, -1.0, 1.0)) / parameters.getLx();
        double ky = Math.acos(NumericGuards.clamp(dy, -1.0, 1.0)) / parameters.getLy();
        return Optional.of(new WaveVector2D(kx, ky));
    }

    /**
     * k 空間の長方形格子を生成します。
     *
     * <p>
     * 並びは kx の外側ループ、ky の内側ループです（各 kx について全 ky を順に並べます）。 点数が 1 の軸は下限の 1 点だけになります。
     * </p>
     *
     * @param spec 格子の指定です
     * @return (kx, ky) の一覧です
     * @throws IllegalArgumentException 点数が 1 未満の場合
     */
    public static List<WaveVector2D> generateKGrid(KGridSpec spec) {
        spec.checkPointCounts();
        int nx = spec.getNx();
        int ny = spec.getNy();
        double kxMin = spec.getKxMin();
        double kyMin = spec.getKyMin();
        double kxStep = (nx > 1) ? (spec.resolvedKxMax() - kxMin) / (nx - 1) : 0.0;
        double kyStep = (ny > 1) ? (spec.resolvedKyMax() - kyMin) / (ny - 1) : 0.0;

        List<WaveVector2D> grid = new ArrayList<>(nx * ny);
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                grid.add(new WaveVector2D(kxMin + i * kxStep, kyMin + j * kyStep));
            }
        }
        return Collections.unmodifiableList(grid);
    }

    /**
     * 固定エネルギーで k 格子上の D と許容判定を評価します。
     *
     * @param energy エネルギー E です
     * @param grid k 格子です
     * @return 各 k 点の評価結果です
     */
    public List<KPointSample> bandStructure(double energy, List<WaveVector2D> grid) {
        List<KPointSample> samples = new ArrayList<>(grid.size());
        for (WaveVector2D k : grid) {
            double d = dispersion(energy, k.getKx(), k.getKy());
            samples.add(new KPointSample(k.getKx(), k.getKy(), d, BlochCondition.isAllowed(d),
                    k.magnitude()));
        }
        return Collections.unmodifiableList(samples);
    }

    /**
     * [eMin, eMax] を {@value #ENERGY_SLICE_DIVISIONS} 等分した各エネルギーで、k 格子上の許容点を数えます。
     *
     * @param eMin 下端エネルギーです
     * @param eMax 上端エネルギーです
     * @param grid k 格子です
     * @return エネルギーごとの評価結果です（昇順）
     */
    public List<EnergySlice> scanEnergySlices(double eMin, double eMax, List<WaveVector2D> grid) {
        double step = (eMax - eMin) / ENERGY_SLICE_DIVISIONS;
        List<EnergySlice> slices = new ArrayList<>(ENERGY_SLICE_DIVISIONS + 1);
        for (int i = 0; i <= ENERGY_SLICE_DIVISIONS; i++) {
            double energy = eMin + i * step;
            List<KPointSample> samples = bandStructure(energy, grid);
            int allowedCount = 0;
            for (KPointSample s : samples) {
                if (s.isAllowed()) {
                    allowedCount++;
                }
            }
            slices.add(new EnergySlice(energy, allowedCount, samples));
        }
        return Collections.unmodifiableList(slices);
    }

    /**
     * (kx, ky) での曲率から有効質量テンソルを見積もります。
     *
     * <p>
     * 刻み {@value #CURVATURE_STEP} の中心差分で D2d の二階微分を取り、m* = 1 / (∂²/∂k²) とします。 曲率がちょうど 0
     * の成分は +∞ です。分離型の仮定により非対角成分は 0 に固定します。
     * </p>
     *
     * @param energy エネルギー E です
     * @param kx 波数の x 成分です
     * @param ky 波数の y 成分です
     * @return 有効質量テンソルです
     */
    public EffectiveMassTensor effectiveMass(double energy, double kx, double ky) {
        double dk = CURVATURE_STEP;
        double center = dispersion(energy, kx, ky);
        double xPlus = dispersion(energy, kx + dk, ky);
        double xMinus = dispersion(energy, kx - dk, ky);
        double yPlus = dispersion(energy, kx, ky + dk);
        double yMinus = dispersion(energy, kx, ky - dk);

        double d2x = (xPlus - 2.0 * center + xMinus) / (dk * dk);
        double d2y = (yPlus - 2.0 * center + yMinus) / (dk * dk);

        return new EffectiveMassTensor(inverseCurvature(d2x), inverseCurvature(d2y), 0.0);
    }

    private static double inverseCurvature(double curvature) {
        return (curvature != 0.0) ? 1.0 / curvature : Double.POSITIVE_INFINITY;
    }
}
