package io.github.yok.kp.app;

import io.github.yok.kp.core.band.BandEdgeScanner;
import io.github.yok.kp.core.model.DispersionRelation;
import io.github.yok.kp.core.model.ExtendedKpParameters;
import io.github.yok.kp.core.model.ExtendedKronigPenneyModel;
import io.github.yok.kp.core.model.MultilayerKronigPenneyModel;
import io.github.yok.kp.core.model.SimpleKpParameters;
import io.github.yok.kp.core.model.SimpleKronigPenneyModel;
import io.github.yok.kp.core.transfer.Layer;
import io.github.yok.kp.core.twod.Separable2DParameters;
import io.github.yok.kp.core.twod.SeparableEnergySurface;
import io.github.yok.kp.core.twod.SeparableKronigPenney2D;
import io.github.yok.kp.out.CsvResultWriter;
import io.github.yok.kp.out.ResultWriter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 分散モデル・バンド端スキャナ・結果出力の Bean 定義を行う設定クラスです。
 *
 * <p>
 * kp.model.variant に応じて 1 次元の分散モデルを 1 つ組み立てます。 物理パラメータの妥当性はここで確認し、コアには検証済みの値だけを渡します。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class KronigPenneyConfiguration {

    /**
     * kp-solver の設定値（kp.*）です。
     */
    private final KpProperties p;

    /**
     * 選択されたモデルの 1 次元分散関係を生成します。
     *
     * <p>
     * SEPARABLE_2D の場合は、各軸で共有する 1 次元因子（単純 KP）を返します。
     * </p>
     *
     * @return 分散関係です
     * @throws IllegalStateException パラメータが不正な場合に発生します
     */
    @Bean
    public DispersionRelation dispersionRelation() {
        double mu = p.getModel().getMu();
        requirePositive("model.mu", mu);

        switch (p.getModel().getVariant()) {
            case SIMPLE: {
                KpProperties.Simple s = p.getSimple();
                requirePositive("simple.a", s.getA());
                requirePositive("simple.b", s.getB());
                return new SimpleKronigPenneyModel(
                        new SimpleKpParameters(s.getA(), s.getB(), s.getV0(), mu));
            }
            case EXTENDED: {
                KpProperties.Extended e = p.getExtended();
                requirePositive("extended.a", e.getA());
                requirePositive("extended.b", e.getB());
                if (e.getU2() < e.getU1()) {
                    throw new IllegalStateException("extended.u2 は extended.u1 以上を指定してください: u1="
                            + e.getU1() + ", u2=" + e.getU2());
                }
                return new ExtendedKronigPenneyModel(
                        new ExtendedKpParameters(e.getA(), e.getB(), e.getU1(), e.getU2(), mu));
            }
            case MULTILAYER: {
                List<Layer> layers = LayerSpecParser.parseLayers(p.getMultilayer().getLayers());
                if (layers.isEmpty()) {
                    throw new IllegalStateException("multilayer.layers に層が 1 つもありません");
                }
                for (Layer layer : layers) {
                    requirePositive("multilayer.layers の幅", layer.getWidth());
                }
                return new MultilayerKronigPenneyModel(layers, mu);
            }
            case SEPARABLE_2D:
                return separableKronigPenney2D().getAxisModel();
            default:
                throw new IllegalStateException("未対応のモデルです: " + p.getModel().getVariant());
        }
    }

    /**
     * 分離型 2 次元モデルのパラメータを生成します。
     *
     * @return 2 次元パラメータです
     * @throws IllegalStateException パラメータが不正な場合に発生します
     */
    @Bean
    public Separable2DParameters separable2DParameters() {
        KpProperties.TwoDimensional t = p.getTwoDimensional();
        requirePositive("twoDimensional.lx", t.getLx());
        requirePositive("twoDimensional.ly", t.getLy());
        requirePositive("twoDimensional.a", t.getA());
        requirePositive("twoDimensional.b", t.getB());
        return new Separable2DParameters(t.getLx(), t.getLy(), t.getA(), t.getB(), t.getV0(),
                p.getModel().getMu());
    }

    /**
     * 分離型 2 次元モデルを生成します。
     *
     * @return 2 次元モデルです
     */
    @Bean
    public SeparableKronigPenney2D separableKronigPenney2D() {
        return new SeparableKronigPenney2D(separable2DParameters());
    }

    /**
     * 分離型ポテンシャルのエネルギー面を生成します。
     *
     * @return エネルギー面です
     */
    @Bean
    public SeparableEnergySurface separableEnergySurface() {
        return SeparableEnergySurface.of(separable2DParameters());
    }

    /**
     * バンド端スキャナを生成します。
     *
     * @return スキャナです
     */
    @Bean
    public BandEdgeScanner bandEdgeScanner() {
        return new BandEdgeScanner();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0)) {
            throw new IllegalStateException(name + " は正の値を指定してください: " + value);
        }
    }
}
