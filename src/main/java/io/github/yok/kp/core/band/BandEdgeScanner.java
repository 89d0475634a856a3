package io.github.yok.kp.core.band;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.github.yok.kp.core.model.EnergyToDispersion;
import io.github.yok.kp.core.numeric.BisectionRootFinder;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleUnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * エネルギー格子を昇順に走査し、|D(E)| - 1 の符号変化から許容帯の端を求めるクラスです。
 *
 * <p>
 * g(E) = |D(E)| - 1 とし、g ≤ {@value #INSIDE_THRESHOLD} の点を帯の内側とみなします。
 * 外側→内側、内側→外側に変わった格子区間 [E_prev, E_cur] を二分法で詰めて帯端とします。
 * 走査終了時にまだ帯の内側なら、上端は eMax で打ち切ります。
 * </p>
 *
 * <p>
 * 状態（帯の外側 / 帯の内側 {開始点}）は不変の {@link ScanState} として各点に畳み込みます。
 * 帯は昇順で重なりなく並びます。
 * </p>
 */
@Slf4j
public final class BandEdgeScanner {

    /**
     * 帯の内側とみなす g(E) の閾値です。
     */
    public static final double INSIDE_THRESHOLD = 1.0e-10;

    /**
     * 帯端を詰める二分法の許容誤差です。
     */
    public static final double EDGE_TOLERANCE = 1.0e-8;

    /**
     * 帯端を詰める二分法の最大反復回数です。
     */
    public static final int EDGE_MAX_ITERATIONS = 64;

    /**
     * 帯端の二分法です。
     */
    private final BisectionRootFinder edgeFinder;

    /**
     * 既定の許容誤差と反復回数でスキャナを生成します。
     */
    public BandEdgeScanner() {
        this(new BisectionRootFinder(EDGE_TOLERANCE, EDGE_MAX_ITERATIONS));
    }

    /**
     * 帯端の二分法を指定してスキャナを生成します。
     *
     * @param edgeFinder 帯端の二分法です
     */
    public BandEdgeScanner(BisectionRootFinder edgeFinder) {
        this.edgeFinder = edgeFinder;
    }

    /**
     * [eMin, eMax] を steps 等分して許容帯を探索します。
     *
     * @param eMin 下端エネルギーです
     * @param eMax 上端エネルギーです
     * @param steps 分割数です
     * @param dispersion E から D を返す関数です
     * @return 許容帯の一覧です（昇順）
     */
    public List<BandInterval> scan(double eMin, double eMax, int steps,
            EnergyToDispersion dispersion) {
        DoubleUnaryOperator g = e -> Math.abs(dispersion.dispersion(e)) - 1.0;

        ScanState state = ScanState.initial();
        for (double energy : EnergyGrid.uniform(eMin, eMax, steps)) {
            state = state.advance(energy, g, edgeFinder);
        }
        List<BandInterval> bands = state.finish(eMax);

        log.debug("バンド端スキャンを終了しました。範囲=[{}, {}]、分割数={}、帯の数={}", fmt5(eMin), fmt5(eMax),
                steps, bands.size());
        return bands;
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    /**
     * 走査の畳み込み状態です。
     */
    private static final class ScanState {

        /**
         * 直前の格子点です（初回は NaN）。
         */
        final double previousEnergy;

        /**
         * 帯の内側にいるかどうかです。
         */
        final boolean insideBand;

        /**
         * 現在の帯の開始点です（外側では NaN）。
         */
        final double bandStart;

        /**
         * 確定した帯の一覧です（最後に閉じた帯が先頭、空なら null）。
         */
        final BandNode bands;

        ScanState(double previousEnergy, boolean insideBand, double bandStart, BandNode bands) {
            this.previousEnergy = previousEnergy;
            this.insideBand = insideBand;
            this.bandStart = bandStart;
            this.bands = bands;
        }

        static ScanState initial() {
            return new ScanState(Double.NaN, false, Double.NaN, null);
        }

        /**
         * 格子点 energy を 1 つ取り込んだ次の状態を返します。
         */
        ScanState advance(double energy, DoubleUnaryOperator g, BisectionRootFinder edgeFinder) {
            boolean allowed = g.applyAsDouble(energy) <= INSIDE_THRESHOLD;
            boolean hasPrevious = !Double.isNaN(previousEnergy);

            if (!insideBand && allowed && hasPrevious) {
                double edge = edgeFinder.findRoot(g, previousEnergy, energy);
                return new ScanState(energy, true, edge, bands);
            }
            if (insideBand && !allowed && hasPrevious) {
                double edge = edgeFinder.findRoot(g, previousEnergy, energy);
                log.debug("許容帯を検出しました。E_lo={}、E_hi={}", bandStart, edge);
                BandNode closed = new BandNode(new BandInterval(bandStart, edge), bands);
                return new ScanState(energy, false, Double.NaN, closed);
            }
            return new ScanState(energy, insideBand, bandStart, bands);
        }

        /**
         * 走査を終えて帯の一覧を返します。帯の内側で終わった場合は eMax で閉じます。
         */
        List<BandInterval> finish(double eMax) {
            BandNode last = insideBand ? new BandNode(new BandInterval(bandStart, eMax), bands)
                    : bands;
            List<BandInterval> newestFirst = new ArrayList<>();
            for (BandNode node = last; node != null; node = node.previous) {
                newestFirst.add(node.band);
            }
            return ImmutableList.copyOf(Lists.reverse(newestFirst));
        }
    }

    /**
     * 確定した帯を先頭に積む不変の連結リストです。
     */
    private static final class BandNode {

        final BandInterval band;

        final BandNode previous;

        BandNode(BandInterval band, BandNode previous) {
            this.band = band;
            this.previous = previous;
        }
    }
}
