package io.github.yok.kp.app;

import io.github.yok.kp.core.band.BandEdgeScanner;
import io.github.yok.kp.core.band.BandInterval;
import io.github.yok.kp.core.band.EnergyGrid;
import io.github.yok.kp.core.model.DispersionRelation;
import io.github.yok.kp.core.model.DispersionSample;
import io.github.yok.kp.core.twod.EffectiveMassTensor;
import io.github.yok.kp.core.twod.KGridSpec;
import io.github.yok.kp.core.twod.KPointSample;
import io.github.yok.kp.core.twod.SeparableEnergySurface;
import io.github.yok.kp.core.twod.SeparableKronigPenney2D;
import io.github.yok.kp.core.twod.WaveVector2D;
import io.github.yok.kp.out.ResultWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で kp-solver を実行するクラスです。
 *
 * <p>
 * 選択したモデルの D(E) をエネルギー格子上で評価して出力し、許容帯（バンド）の端を探索します。 SEPARABLE_2D の場合は、固定エネルギーでの k
 * 空間評価も出力します。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KpCliRunner implements CommandLineRunner {

    /**
     * kp-solver の設定値（kp.*）です。
     */
    private final KpProperties properties;

    /**
     * 選択されたモデルの 1 次元分散関係です。
     */
    private final DispersionRelation dispersionRelation;

    /**
     * 分離型 2 次元モデルです。
     */
    private final SeparableKronigPenney2D separableKronigPenney2D;

    /**
     * 分離型ポテンシャルのエネルギー面です。
     */
    private final SeparableEnergySurface separableEnergySurface;

    /**
     * バンド端スキャナです。
     */
    private final BandEdgeScanner bandEdgeScanner;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== kp-solver start: Bloch condition band scan ===");
        System.out.print(properties.toMultilineString());

        KpProperties.Scan scan = properties.getScan();
        if (scan.getSteps() < 1) {
            throw new IllegalStateException("scan.steps は 1 以上を指定してください: " + scan.getSteps());
        }
        if (!(scan.getEnergyMax() > scan.getEnergyMin())) {
            throw new IllegalStateException("scan.energyMax は scan.energyMin より大きい値を指定してください: energyMin="
                    + scan.getEnergyMin() + ", energyMax=" + scan.getEnergyMax());
        }

        KpProperties.Model.Variant variant = properties.getModel().getVariant();
        if (variant == KpProperties.Model.Variant.SEPARABLE_2D) {
            runTwoDimensional(variant, scan);
        } else {
            runOneDimensional(variant, scan);
        }
    }

    /**
     * 1 次元モデルの分散評価とバンド探索を実行します。
     *
     * @param variant モデルの種類です
     * @param scan スキャン設定です
     */
    private void runOneDimensional(KpProperties.Model.Variant variant, KpProperties.Scan scan) {
        double[] energies =
                EnergyGrid.uniform(scan.getEnergyMin(), scan.getEnergyMax(), scan.getSteps());
        List<DispersionSample> samples = new ArrayList<>(energies.length);
        int allowedCount = 0;
        for (double e : energies) {
            DispersionSample s = DispersionSample.of(dispersionRelation, e);
            if (s.isAllowed()) {
                allowedCount++;
            }
            samples.add(s);
        }
        resultWriter.writeDispersion(variant, samples);
        log.info("分散評価: variant={}, L={}, 標本数={}, 許容標本数={}", variant,
                fmt5(dispersionRelation.period()), samples.size(), allowedCount);

        List<BandInterval> bands = bandEdgeScanner.scan(scan.getEnergyMin(), scan.getEnergyMax(),
                scan.getSteps(), dispersionRelation);
        resultWriter.writeBands(variant, bands);
        printBands(bands);
    }

    /**
     * 分離型 2 次元モデルの k 空間評価とバンド探索を実行します。
     *
     * @param variant モデルの種類です
     * @param scan スキャン設定です
     */
    private void runTwoDimensional(KpProperties.Model.Variant variant, KpProperties.Scan scan) {
        KpProperties.TwoDimensional t = properties.getTwoDimensional();
        if (t.getNx() < 1 || t.getNy() < 1) {
            throw new IllegalStateException("twoDimensional.nx, twoDimensional.ny は 1 以上を指定してください: nx="
                    + t.getNx() + ", ny=" + t.getNy());
        }

        List<WaveVector2D> grid = SeparableKronigPenney2D.generateKGrid(KGridSpec.builder()
                .lx(t.getLx()).ly(t.getLy()).nx(t.getNx()).ny(t.getNy()).build());
        double energy = t.getEnergy();
        List<KPointSample> samples = separableKronigPenney2D.bandStructure(energy, grid);
        double[] surface = new double[samples.size()];
        for (int i = 0; i < surface.length; i++) {
            KPointSample s = samples.get(i);
            surface[i] = separableEnergySurface.energyAt(s.getKx(), s.getKy());
        }
        resultWriter.writeKSpace(variant, samples, surface);

        Optional<WaveVector2D> k = separableKronigPenney2D.principalK(energy);
        if (k.isPresent()) {
            WaveVector2D kv = k.get();
            EffectiveMassTensor m =
                    separableKronigPenney2D.effectiveMass(energy, kv.getKx(), kv.getKy());
            log.info("E={}: 主波数 kx={}, ky={}, 有効質量 xx={}, yy={}", fmt5(energy),
                    fmt5(kv.getKx()), fmt5(kv.getKy()), m.getXx(), m.getYy());
        } else {
            log.info("E={}: 禁制帯のため主波数はありません", fmt5(energy));
        }

        List<BandInterval> bands = bandEdgeScanner.scan(scan.getEnergyMin(), scan.getEnergyMax(),
                scan.getSteps(), e -> separableKronigPenney2D.dispersion(e, 0.0, 0.0));
        resultWriter.writeBands(variant, bands);
        printBands(bands);
    }

    private static void printBands(List<BandInterval> bands) {
        System.out.println("=== 許容帯 ===");
        if (bands.isEmpty()) {
            System.out.println("（スキャン範囲に許容帯はありません）");
            return;
        }
        for (int i = 0; i < bands.size(); i++) {
            BandInterval b = bands.get(i);
            System.out.println("band " + (i + 1) + ": [" + fmt5(b.getLower()) + ", "
                    + fmt5(b.getUpper()) + "] 幅=" + fmt5(b.width()));
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
