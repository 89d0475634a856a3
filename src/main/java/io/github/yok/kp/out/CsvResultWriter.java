package io.github.yok.kp.out;

import io.github.yok.kp.app.KpProperties;
import io.github.yok.kp.core.band.BandInterval;
import io.github.yok.kp.core.model.DispersionSample;
import io.github.yok.kp.core.twod.KPointSample;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（variant はモデルの種類を小文字にしたもの）。
 * </p>
 *
 * <ul>
 * <li>{@code kp_dispersion_simple.csv}（E, D, allowed, k_minus, k_plus）</li>
 * <li>{@code kp_bands_simple.csv}（E_lo, E_hi）</li>
 * <li>{@code kp_kspace_separable_2d.csv}（kx, ky, D, E, allowed）</li>
 * </ul>
 *
 * <p>
 * 数値は {@code %.12g} で整形します。
 * </p>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "kp";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 分散標本を出力します。
     *
     * @param variant モデルの種類です
     * @param samples 分散標本です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeDispersion(KpProperties.Model.Variant variant,
            List<DispersionSample> samples) {
        requireNonNull(variant, "variant");
        requireNonNull(samples, "samples");

        Path file = resolve("dispersion", variant);
        try (CSVPrinter pr = open(file, "E", "D", "allowed", "k_minus", "k_plus")) {
            for (DispersionSample s : samples) {
                pr.printRecord(fmt(s.getEnergy()), fmt(s.getD()), s.isAllowed(), fmt(s.kMinus()),
                        fmt(s.kPlus()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * 許容帯を出力します。
     *
     * @param variant モデルの種類です
     * @param bands 許容帯です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeBands(KpProperties.Model.Variant variant, List<BandInterval> bands) {
        requireNonNull(variant, "variant");
        requireNonNull(bands, "bands");

        Path file = resolve("bands", variant);
        try (CSVPrinter pr = open(file, "E_lo", "E_hi")) {
            for (BandInterval band : bands) {
                pr.printRecord(fmt(band.getLower()), fmt(band.getUpper()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * k 空間の評価結果を出力します。
     *
     * @param variant モデルの種類です
     * @param samples k 点ごとの評価結果です
     * @param energies 各 k 点のエネルギー面です
     * @throws IllegalArgumentException 引数が不正、または長さが一致しない場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void writeKSpace(KpProperties.Model.Variant variant, List<KPointSample> samples,
            double[] energies) {
        requireNonNull(variant, "variant");
        requireNonNull(samples, "samples");
        requireNonNull(energies, "energies");
        if (samples.size() != energies.length) {
            throw new IllegalArgumentException("samples と energies の長さが一致しません: samples="
                    + samples.size() + ", energies=" + energies.length);
        }

        Path file = resolve("kspace", variant);
        try (CSVPrinter pr = open(file, "kx", "ky", "D", "E", "allowed")) {
            for (int i = 0; i < energies.length; i++) {
                KPointSample s = samples.get(i);
                pr.printRecord(fmt(s.getKx()), fmt(s.getKy()), fmt(s.getD()), fmt(energies[i]),
                        s.isAllowed());
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * 出力先ディレクトリを作成し、ヘッダ付きで CSV を開きます。
     *
     * @param file 出力ファイルです
     * @param header ヘッダです
     * @return CSV プリンタです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private CSVPrinter open(Path file, String... header) throws IOException {
        Files.createDirectories(outputDir);
        Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader(header).build().print(w);
    }

    /**
     * 命名規約に従って出力パスを作成します。
     *
     * <p>
     * 例: {@code kp_bands_multilayer.csv}
     * </p>
     *
     * @param kind 量の識別子（dispersion/bands/kspace）
     * @param variant モデルの種類です
     * @return 出力パスです
     */
    Path resolve(String kind, KpProperties.Model.Variant variant) {
        return outputDir.resolve(
                FILE_HEAD + "_" + kind + "_" + variant.name().toLowerCase(Locale.ROOT) + ".csv");
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.12g", v);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " は null 不可です");
        }
    }
}
