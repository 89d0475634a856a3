package io.github.yok.kp.core.twod;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.kp.core.model.SimpleKronigPenneyModel;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link SeparableKronigPenney2D} の単体テストです。
 */
class SeparableKronigPenney2DTest {

    private SeparableKronigPenney2D model;

    @BeforeEach
    void setUp() {
        model = new SeparableKronigPenney2D(
                new Separable2DParameters(1.0, 1.0, 0.5, 0.25, 10.0, 1.0));
    }

    @Test
    @DisplayName("D2d は kx と ky の入れ替えに対して対称である")
    void dispersion_isSymmetricInAxes() {
        for (double e : new double[] {3.0, 15.0, 27.0}) {
            assertEquals(model.dispersion(e, 0.3, 1.2), model.dispersion(e, 1.2, 0.3), 1e-10);
        }
    }

    @Test
    @DisplayName("D2d は 1 次元の D(E) と一致する")
    void dispersion_equalsAxisDispersion() {
        double expected = SimpleKronigPenneyModel.dispersion(15.0, model.getParameters().axisParameters());
        assertEquals(expected, model.dispersion(15.0, 0.7, 2.1));
        assertEquals(0.024399973779894002, expected, 1e-9);
    }

    @Test
    @DisplayName("許容帯では主波数を返し、禁制帯では空を返す")
    void principalK_presentOnlyInsideBand() {
        Optional<WaveVector2D> k = model.principalK(15.0);
        assertTrue(k.isPresent());
        assertEquals(Math.acos(0.024399973779894002), k.get().getKx(), 1e-9);
        assertEquals(k.get().getKx(), k.get().getKy(), 1e-15);

        assertFalse(model.principalK(5.0).isPresent());
        assertFalse(model.isAllowed(5.0, 0.0, 0.0));
    }

    @Test
    @DisplayName("k 格子は kx を外側、ky を内側として並ぶ")
    void generateKGrid_orderIsKxOuter() {
        List<WaveVector2D> grid = SeparableKronigPenney2D.generateKGrid(
                KGridSpec.builder().lx(1.0).ly(2.0).nx(3).ny(3).build());

        assertEquals(9, grid.size());
        assertEquals(0.0, grid.get(0).getKx());
        assertEquals(0.0, grid.get(0).getKy());
        assertEquals(0.0, grid.get(1).getKx());
        assertEquals(Math.PI / 4.0, grid.get(1).getKy(), 1e-12);
        assertEquals(Math.PI / 2.0, grid.get(3).getKx(), 1e-12);
        assertEquals(0.0, grid.get(3).getKy());
        assertEquals(Math.PI, grid.get(8).getKx(), 1e-12);
        assertEquals(Math.PI / 2.0, grid.get(8).getKy(), 1e-12);
    }

    @Test
    @DisplayName("点数 1 の軸は下限の 1 点だけになる")
    void generateKGrid_singlePointAxis() {
        List<WaveVector2D> grid = SeparableKronigPenney2D.generateKGrid(
                KGridSpec.builder().lx(1.0).ly(1.0).nx(1).ny(2).kxMin(0.5).build());

        assertEquals(2, grid.size());
        assertEquals(0.5, grid.get(0).getKx());
        assertEquals(0.5, grid.get(1).getKx());
        assertEquals(Math.PI, grid.get(1).getKy(), 1e-12);
    }

    @Test
    @DisplayName("点数 0 の格子指定は例外になる")
    void generateKGrid_rejectsEmptyAxis() {
        KGridSpec spec = KGridSpec.builder().lx(1.0).ly(1.0).nx(0).ny(3).build();
        assertThrows(IllegalArgumentException.class,
                () -> SeparableKronigPenney2D.generateKGrid(spec));
    }

    @Test
    @DisplayName("固定エネルギーの評価は格子点ごとに |k| と許容判定を持つ")
    void bandStructure_reportsEveryGridPoint() {
        List<WaveVector2D> grid = SeparableKronigPenney2D.generateKGrid(
                KGridSpec.builder().lx(1.0).ly(1.0).nx(2).ny(2).build());
        List<KPointSample> samples = model.bandStructure(15.0, grid);

        assertEquals(4, samples.size());
        KPointSample corner = samples.get(3);
        assertEquals(Math.hypot(Math.PI, Math.PI), corner.getKMagnitude(), 1e-12);
        assertTrue(corner.isAllowed());
    }

    @Test
    @DisplayName("エネルギースライスは 101 個で、許容点数は格子点数以下になる")
    void scanEnergySlices_hasHundredAndOneSlices() {
        List<WaveVector2D> grid = SeparableKronigPenney2D.generateKGrid(
                KGridSpec.builder().lx(1.0).ly(1.0).nx(2).ny(3).build());
        List<EnergySlice> slices = model.scanEnergySlices(0.0, 30.0, grid);

        assertEquals(101, slices.size());
        assertEquals(0.0, slices.get(0).getEnergy());
        assertEquals(30.0, slices.get(100).getEnergy(), 1e-12);
        for (EnergySlice s : slices) {
            assertTrue(s.getAllowedCount() >= 0 && s.getAllowedCount() <= grid.size());
            assertEquals(grid.size(), s.getSamples().size());
        }
        assertEquals(grid.size(), slices.get(50).getAllowedCount());
    }

    @Test
    @DisplayName("有効質量は NaN にならず、非対角成分は 0 である")
    void effectiveMass_isFiniteOrInfinite() {
        EffectiveMassTensor m = model.effectiveMass(15.0, 0.4, 0.4);
        assertFalse(Double.isNaN(m.getXx()));
        assertFalse(Double.isNaN(m.getYy()));
        assertEquals(0.0, m.getXy());
        assertEquals(Double.POSITIVE_INFINITY, m.getXx());
    }
}
