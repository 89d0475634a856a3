package io.github.yok.kp.app;

import javax.validation.Valid;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * kp-solver の設定値（kp.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時のモデル選択とスキャン範囲に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "kp")
public class KpProperties {

    /**
     * モデル選択です。
     */
    @Valid
    private Model model = new Model();

    /**
     * 単純 KP の設定です。
     */
    @Valid
    private Simple simple = new Simple();

    /**
     * 拡張 KP の設定です。
     */
    @Valid
    private Extended extended = new Extended();

    /**
     * 多層モデルの設定です。
     */
    private Multilayer multilayer = new Multilayer();

    /**
     * 分離型 2 次元モデルの設定です。
     */
    @Valid
    private TwoDimensional twoDimensional = new TwoDimensional();

    /**
     * エネルギースキャンの設定です。
     */
    @Valid
    private Scan scan = new Scan();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "kp")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Model m = getModel();
        Simple s = getSimple();
        Extended e = getExtended();
        TwoDimensional t = getTwoDimensional();
        Scan sc = getScan();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "model",
                // variant: 分散モデルの種類
                "variant", m.getVariant(),
                // mu: ħ²/2m
                "mu", m.getMu());

        switch (m.getVariant()) {
            case SIMPLE:
                appendSection(sb, nl, "simple", "a", s.getA(), "b", s.getB(), "v0", s.getV0());
                break;
            case EXTENDED:
                appendSection(sb, nl, "extended", "a", e.getA(), "b", e.getB(), "u1", e.getU1(),
                        "u2", e.getU2());
                break;
            case MULTILAYER:
                appendSection(sb, nl, "multilayer", "layers", getMultilayer().getLayers());
                break;
            case SEPARABLE_2D:
                appendSection(sb, nl, "twoDimensional", "lx", t.getLx(), "ly", t.getLy(), "a",
                        t.getA(), "b", t.getB(), "v0", t.getV0(), "energy", t.getEnergy(), "nx",
                        t.getNx(), "ny", t.getNy());
                break;
            default:
                break;
        }

        appendSection(sb, nl, "scan",
                // energyMin/energyMax: スキャン範囲
                "energyMin", sc.getEnergyMin(), "energyMax", sc.getEnergyMax(),
                // steps: 分割数（標本数は steps+1）
                "steps", sc.getSteps());

        appendSection(sb, nl, "output", "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Model {

        /**
         * 分散モデルの種類です。
         */
        private Variant variant = Variant.SIMPLE;

        /**
         * 質量スケール mu = ħ²/2m です。
         */
        @Positive
        private double mu = 1.0;

        public enum Variant {
            SIMPLE, EXTENDED, MULTILAYER, SEPARABLE_2D
        }
    }

    @Data
    public static class Simple {

        /**
         * 障壁の半幅 a です。
         */
        @Positive
        private double a = 1.0;

        /**
         * 片側の井戸幅 b です。
         */
        @Positive
        private double b = 0.5;

        /**
         * 障壁の高さ V0 です。
         */
        private double v0 = 10.0;
    }

    @Data
    public static class Extended {

        @Positive
        private double a = 0.25;

        @Positive
        private double b = 0.25;

        /**
         * 1 つ目の障壁の高さです。
         */
        private double u1 = 8.0;

        /**
         * 2 つ目の障壁の高さです（u1 以上）。
         */
        private double u2 = 12.0;
    }

    @Data
    public static class Multilayer {

        /**
         * 層列の簡易表記です。
         *
         * <p>
         * {@code b:幅} は井戸、{@code U:ポテンシャル:幅} は障壁、数値だけなら井戸の幅です。 例: {@code b:0.4,U:12:0.2,b:0.4}
         * </p>
         */
        private String layers = "b:0.4,U:12:0.2,b:0.4";
    }

    @Data
    public static class TwoDimensional {

        /**
         * x 方向の格子定数です。
         */
        @Positive
        private double lx = 1.0;

        /**
         * y 方向の格子定数です。
         */
        @Positive
        private double ly = 1.0;

        @Positive
        private double a = 0.5;

        @Positive
        private double b = 0.25;

        private double v0 = 10.0;

        /**
         * k 空間の評価に使う固定エネルギーです。
         */
        private double energy = 15.0;

        /**
         * kx 方向の点数です。
         */
        @Positive
        private int nx = 21;

        /**
         * ky 方向の点数です。
         */
        @Positive
        private int ny = 21;
    }

    @Data
    public static class Scan {

        /**
         * スキャン下端エネルギーです。
         */
        private double energyMin = 0.0;

        /**
         * スキャン上端エネルギーです。
         */
        private double energyMax = 50.0;

        /**
         * 分割数です。
         */
        @Positive
        private int steps = 5000;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
