package io.github.yok.kp.core.numeric;

/**
 * 分散関係の評価で共通に使う数値ガードと波数計算をまとめたクラスです。
 *
 * <p>
 * 分散式は α, β, γ で割り算をするため、バンド端（E=0 や E=V0）で分母がちょうど 0 になります。
 * 例外で扱う代わりに、{@link #safe(double)} で符号付きの微小値へ置き換えて計算を続けます。
 * </p>
 */
public final class NumericGuards {

    /**
     * {@link #safe(double)} が 0 とみなす閾値です。
     */
    public static final double SAFE_EPSILON = 1.0e-10;

    /**
     * 無限大を置き換える有限値の大きさです。
     */
    public static final double SAFE_INFINITY = 1.0e6;

    /**
     * 質量スケール mu（ħ²/2m）の下限です。
     */
    public static final double MU_FLOOR = 1.0e-12;

    private NumericGuards() {
    }

    /**
     * x を [lo, hi] に丸め込みます。
     *
     * @param x 値です
     * @param lo 下限です
     * @param hi 上限です
     * @return 丸め込んだ値です
     */
    public static double clamp(double x, double lo, double hi) {
        return Math.min(Math.max(x, lo), hi);
    }

    /**
     * 割り算や逆三角関数の定義域エラーを避けるため、特異な値を有限の値へ置き換えます。
     *
     * <ul>
     * <li>NaN は +ε</li>
     * <li>±∞ は ±{@value #SAFE_INFINITY}</li>
     * <li>|x| ≤ ε は x と同じ符号の ε</li>
     * </ul>
     *
     * @param x 値です
     * @return ガード後の値です
     */
    public static double safe(double x) {
        if (Double.isNaN(x)) {
            return SAFE_EPSILON;
        }
        if (Double.isInfinite(x)) {
            return (x > 0.0) ? SAFE_INFINITY : -SAFE_INFINITY;
        }
        if (Math.abs(x) <= SAFE_EPSILON) {
            return (x < 0.0) ? -SAFE_EPSILON : SAFE_EPSILON;
        }
        return x;
    }

    /**
     * ポテンシャル 0 の領域での振動波数 α = sqrt(E/mu) を返します。
     *
     * @param energy エネルギー E です（負の値は 0 として扱います）
     * @param mu 質量スケール ħ²/2m です
     * @return α です
     */
    public static double alpha(double energy, double mu) {
        return Math.sqrt(Math.max(energy, 0.0) / Math.max(mu, MU_FLOOR));
    }

    /**
     * E &lt; V0 のときの障壁内の減衰定数 β = sqrt((V0-E)/mu) を返します。
     *
     * @param v0 障壁の高さです
     * @param energy エネルギー E です
     * @param mu 質量スケール ħ²/2m です
     * @return β です（V0 ≤ E なら 0）
     */
    public static double beta(double v0, double energy, double mu) {
        double d = v0 - energy;
        return (d > 0.0) ? Math.sqrt(d / Math.max(mu, MU_FLOOR)) : 0.0;
    }

    /**
     * E &gt; V0 のときの障壁内の振動波数 γ = sqrt((E-V0)/mu) を返します。
     *
     * @param energy エネルギー E です
     * @param v0 障壁の高さです
     * @param mu 質量スケール ħ²/2m です
     * @return γ です（E ≤ V0 なら 0）
     */
    public static double gamma(double energy, double v0, double mu) {
        double d = energy - v0;
        return (d > 0.0) ? Math.sqrt(d / Math.max(mu, MU_FLOOR)) : 0.0;
    }
}
