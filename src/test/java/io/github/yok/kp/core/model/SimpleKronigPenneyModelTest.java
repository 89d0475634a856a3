package io.github.yok.kp.core.model;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.kp.core.transfer.Layer;
import io.github.yok.kp.core.transfer.TransferMatrix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link SimpleKronigPenneyModel} の単体テストです。
 */
class SimpleKronigPenneyModelTest {

    private SimpleKronigPenneyModel model;

    @BeforeEach
    void setUp() {
        model = new SimpleKronigPenneyModel(SimpleKpParameters.of(1.0, 0.5, 10.0));
    }

    @Test
    @DisplayName("周期は 2a + 2b になる")
    void period_isTwiceBarrierPlusWell() {
        assertEquals(3.0, model.period(), 1e-15);
    }

    @Test
    @DisplayName("障壁より上の E=15 は許容帯に入る")
    void aboveBarrier_isAllowed() {
        assertEquals(-0.43859688702705557, model.dispersion(15.0), 1e-9);
        assertTrue(model.isAllowed(15.0));
    }

    @Test
    @DisplayName("障壁より下の E=5 は禁制帯になる")
    void belowBarrier_isForbidden() {
        assertEquals(58.50677829690322, model.dispersion(5.0), 1e-6);
        assertFalse(model.isAllowed(5.0));
    }

    @Test
    @DisplayName("E=0 と E=V0 では境界値 1.0 を返す")
    void boundaryEnergies_returnSentinel() {
        assertEquals(1.0, model.dispersion(0.0));
        assertEquals(1.0, model.dispersion(10.0));
        assertEquals(1.0, model.dispersion(-3.0));
    }

    @Test
    @DisplayName("許容判定は |D| ≤ 1 + 1e-7 と一致する")
    void allowed_matchesBlochCondition() {
        for (int i = 0; i <= 200; i++) {
            double e = 0.1 * i;
            double d = model.dispersion(e);
            assertEquals(Math.abs(d) <= 1.0 + 1e-7, model.isAllowed(e), "E=" + e);
        }
    }

    @Test
    @DisplayName("主波数は常に [0, π/L] に収まる")
    void principalK_isInFirstZone() {
        for (int i = 0; i <= 100; i++) {
            double k = model.principalK(0.3 * i);
            assertTrue(k >= 0.0 && k <= Math.PI / model.period() + 1e-15, "k=" + k);
        }
    }

    @Test
    @DisplayName("障壁幅 0 の閉形式は井戸 1 層の転送行列と一致する")
    void zeroWidthBarrier_matchesTransferMatrix() {
        SimpleKpParameters p = new SimpleKpParameters(0.0, 0.7, 10.0, 1.0);
        for (double e : new double[] {2.0, 5.0, 15.0, 30.0}) {
            double closed = SimpleKronigPenneyModel.dispersion(e, p);
            double matrix = TransferMatrix.ofLayer(e, Layer.well(0.7), 1.0).halfTrace();
            assertEquals(matrix, closed, 1e-9, "E=" + e);
        }
    }

    @Test
    @DisplayName("evaluate は D と周期をまとめて返す")
    void evaluate_bundlesDispersionAndPeriod() {
        DispersionResult r = model.evaluate(15.0);
        assertEquals(model.dispersion(15.0), r.getD());
        assertEquals(3.0, r.getPeriod(), 1e-15);
    }
}
