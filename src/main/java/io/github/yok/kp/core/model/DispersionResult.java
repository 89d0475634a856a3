package io.github.yok.kp.core.model;

import lombok.Value;

/**
 * ある E での D(E) と単位胞の周期 L の組です。
 */
@Value
public class DispersionResult {

    /**
     * ブロッホ条件の右辺 D です。
     */
    double d;

    /**
     * 単位胞の周期 L です。
     */
    double period;
}
