package io.github.yok.kp.core.numeric;

import java.util.function.DoubleUnaryOperator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 挟み込み区間 [lo, hi] 上で関数の根を二分法で求めるクラスです。
 *
 * <p>
 * 区間内で符号反転しているかどうかは検証しません。符号反転がない場合も必ず終了し、 区間内のいずれかの点を返します。
 * 最大反復回数は無限ループを防ぐための上限として常に守られます。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public final class BisectionRootFinder {

    /**
     * 区間幅の絶対許容誤差です。
     */
    private final double tolerance;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * f の根を [lo, hi] 内で探索します。
     *
     * <p>
     * 中点 mid を評価し、f(lo)·f(mid) ≤ 0 なら [lo, mid]、そうでなければ [mid, hi] を残します。
     * 区間幅が許容誤差以下になるか、反復回数の上限に達した時点の中点を返します。
     * </p>
     *
     * @param f 対象の関数です
     * @param lo 区間の下端です
     * @param hi 区間の上端です
     * @return 根の推定値です
     */
    public double findRoot(DoubleUnaryOperator f, double lo, double hi) {
        double left = lo;
        double right = hi;
        int iter = 0;
        while (true) {
            double mid = left + 0.5 * (right - left);
            if (Math.abs(right - left) <= tolerance || iter >= maxIterations) {
                return mid;
            }
            double fLeft = f.applyAsDouble(left);
            double fMid = f.applyAsDouble(mid);
            if (fLeft * fMid <= 0.0) {
                right = mid;
            } else {
                left = mid;
            }
            iter++;
        }
    }
}
