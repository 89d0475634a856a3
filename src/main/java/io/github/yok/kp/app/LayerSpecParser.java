package io.github.yok.kp.app;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import io.github.yok.kp.core.transfer.Layer;
import java.util.List;

/**
 * 多層モデルの層列を簡易表記から読み取るクラスです。
 *
 * <ul>
 * <li>{@code b:W} はポテンシャル 0、幅 W の井戸</li>
 * <li>{@code U:V:W} はポテンシャル V、幅 W の層</li>
 * <li>{@code W} だけなら幅 W の井戸</li>
 * </ul>
 *
 * <p>
 * トークンはカンマ区切りで、空のトークンは無視します。
 * </p>
 */
public final class LayerSpecParser {

    private static final Splitter TOKEN_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private static final Splitter PART_SPLITTER = Splitter.on(':').trimResults();

    private LayerSpecParser() {
    }

    /**
     * 層列の簡易表記を解析します。
     *
     * @param spec 簡易表記です（例: {@code b:0.3,U:8:0.2,b:0.3}）
     * @return 層列です（入力順）
     * @throws IllegalArgumentException 表記が不正な場合
     */
    public static List<Layer> parseLayers(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("layers は null 不可です");
        }
        ImmutableList.Builder<Layer> layers = ImmutableList.builder();
        for (String token : TOKEN_SPLITTER.split(spec)) {
            layers.add(parseToken(token));
        }
        return layers.build();
    }

    /**
     * 1 トークンを解析します。
     *
     * @param token トークンです
     * @return 層です
     * @throws IllegalArgumentException 表記が不正な場合
     */
    public static Layer parseToken(String token) {
        List<String> parts = PART_SPLITTER.splitToList(token);
        switch (parts.get(0)) {
            case "b":
                requireParts(token, parts, 2);
                return Layer.well(parseNumber(token, parts.get(1)));
            case "U":
                requireParts(token, parts, 3);
                return new Layer(parseNumber(token, parts.get(2)),
                        parseNumber(token, parts.get(1)));
            default:
                return Layer.well(parseNumber(token, parts.get(0)));
        }
    }

    private static void requireParts(String token, List<String> parts, int expected) {
        if (parts.size() != expected) {
            throw new IllegalArgumentException("層の表記が不正です（要素数 " + expected + " が必要）: " + token);
        }
    }

    private static double parseNumber(String token, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("層の表記に数値でない値があります: " + token, e);
        }
    }
}
