package io.github.yok.kp.core.transfer;

import lombok.Value;

/**
 * ポテンシャルが一定の 1 層（幅とポテンシャル）を表すクラスです。
 *
 * <p>
 * 層の並び順は単位胞内の伝搬方向を表すため、積層では順序に意味があります。
 * </p>
 */
@Value
public class Layer {

    /**
     * 層の幅です（正）。
     */
    double width;

    /**
     * 層内のポテンシャルです（負の値も可）。
     */
    double potential;

    /**
     * ポテンシャル 0 の井戸層を生成します。
     *
     * @param width 層の幅です
     * @return 井戸層です
     */
    public static Layer well(double width) {
        return new Layer(width, 0.0);
    }
}
