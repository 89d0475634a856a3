package io.github.yok.kp.core.model;

/**
 * 周期 L を持つ 1 次元分散モデルを表すインタフェースです。
 *
 * <p>
 * 単純 KP、拡張 KP、多層の各モデルを差し替えるための境界です。
 * </p>
 */
public interface DispersionRelation extends EnergyToDispersion {

    /**
     * 単位胞の周期 L を返します。
     *
     * @return 周期です
     */
    double period();

    /**
     * D(E) と周期 L の組を返します。
     *
     * @param energy エネルギー E です
     * @return 評価結果です
     */
    default DispersionResult evaluate(double energy) {
        return new DispersionResult(dispersion(energy), period());
    }

    /**
     * E が許容帯に属するかを返します。
     *
     * @param energy エネルギー E です
     * @return |D(E)| ≤ 1 + 1e-7 なら true です
     */
    default boolean isAllowed(double energy) {
        return BlochCondition.isAllowed(dispersion(energy));
    }

    /**
     * 主波数 k = acos(clamp(D)) / L を返します。
     *
     * <p>
     * 禁制帯の E に対しても丸めた D に対応する k を返します。物理的に有効かは {@link #isAllowed(double)} で判定してください。
     * </p>
     *
     * @param energy エネルギー E です
     * @return [0, π/L] の波数です
     */
    default double principalK(double energy) {
        return BlochCondition.principalK(dispersion(energy), period());
    }
}
