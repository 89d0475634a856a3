package io.github.yok.kp.core.twod;

import static com.google.common.base.Preconditions.checkArgument;
import lombok.Builder;
import lombok.Value;

/**
 * k 空間格子の指定です。
 *
 * <p>
 * 範囲を省略した軸は第 1 ブリルアンゾーンの [0, π/L] を使います。
 * </p>
 */
@Value
@Builder
public class KGridSpec {

    /**
     * x 方向の格子定数です。
     */
    double lx;

    /**
     * y 方向の格子定数です。
     */
    double ly;

    /**
     * x 方向の点数です（1 以上）。
     */
    int nx;

    /**
     * y 方向の点数です（1 以上）。
     */
    int ny;

    @Builder.Default
    double kxMin = 0.0;

    /**
     * kx の上限です（null なら π/Lx）。
     */
    Double kxMax;

    @Builder.Default
    double kyMin = 0.0;

    /**
     * ky の上限です（null なら π/Ly）。
     */
    Double kyMax;

    /**
     * kx の上限を返します。
     *
     * @return kx の上限です
     */
    public double resolvedKxMax() {
        return (kxMax != null) ? kxMax : Math.PI / lx;
    }

    /**
     * ky の上限を返します。
     *
     * @return ky の上限です
     */
    public double resolvedKyMax() {
        return (kyMax != null) ? kyMax : Math.PI / ly;
    }

    /**
     * 点数が 1 以上であることを確認します。
     *
     * @throws IllegalArgumentException nx または ny が 1 未満の場合
     */
    void checkPointCounts() {
        checkArgument(nx >= 1 && ny >= 1, "k 格子の点数は 1 以上が必要です: nx=%s, ny=%s", nx, ny);
    }
}
