package io.github.yok.kp.app;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.github.yok.kp.core.band.BandEdgeScanner;
import io.github.yok.kp.core.band.BandInterval;
import io.github.yok.kp.core.model.DispersionSample;
import io.github.yok.kp.core.twod.KPointSample;
import io.github.yok.kp.out.ResultWriter;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * {@link KpCliRunner} の単体テストです。
 *
 * <p>
 * 結果出力はモックに差し替え、実行の流れと出力内容だけを確認します。
 * </p>
 */
@ExtendWith(MockitoExtension.class)
class KpCliRunnerTest {

    private KpProperties properties;

    @Mock
    private ResultWriter resultWriter;

    @Captor
    private ArgumentCaptor<List<DispersionSample>> dispersionCaptor;

    @Captor
    private ArgumentCaptor<List<BandInterval>> bandsCaptor;

    @Captor
    private ArgumentCaptor<List<KPointSample>> kSpaceCaptor;

    @Captor
    private ArgumentCaptor<double[]> energiesCaptor;

    @BeforeEach
    void setUp() {
        properties = new KpProperties();
        properties.getScan().setEnergyMin(0.0);
        properties.getScan().setEnergyMax(20.0);
        properties.getScan().setSteps(200);
    }

    private KpCliRunner newRunner() {
        KronigPenneyConfiguration configuration = new KronigPenneyConfiguration(properties);
        return new KpCliRunner(properties, configuration.dispersionRelation(),
                configuration.separableKronigPenney2D(), configuration.separableEnergySurface(),
                new BandEdgeScanner(), resultWriter);
    }

    @Test
    @DisplayName("1 次元モデルでは steps+1 個の分散標本と許容帯を出力する")
    void run_oneDimensional_writesDispersionAndBands() {
        newRunner().run();

        verify(resultWriter).writeDispersion(eq(KpProperties.Model.Variant.SIMPLE),
                dispersionCaptor.capture());
        List<DispersionSample> samples = dispersionCaptor.getValue();
        assertEquals(201, samples.size());
        assertEquals(0.0, samples.get(0).getEnergy());
        assertEquals(20.0, samples.get(200).getEnergy(), 1e-12);

        verify(resultWriter).writeBands(eq(KpProperties.Model.Variant.SIMPLE),
                bandsCaptor.capture());
        assertFalse(bandsCaptor.getValue().isEmpty());

        verify(resultWriter, never()).writeKSpace(any(), anyList(), any());
    }

    @Test
    @DisplayName("分離型 2 次元モデルでは k 空間の評価と許容帯を出力する")
    void run_separable2D_writesKSpaceAndBands() {
        properties.getModel().setVariant(KpProperties.Model.Variant.SEPARABLE_2D);
        properties.getTwoDimensional().setNx(3);
        properties.getTwoDimensional().setNy(2);

        newRunner().run();

        verify(resultWriter).writeKSpace(eq(KpProperties.Model.Variant.SEPARABLE_2D),
                kSpaceCaptor.capture(), energiesCaptor.capture());
        assertEquals(6, kSpaceCaptor.getValue().size());
        assertEquals(6, energiesCaptor.getValue().length);

        verify(resultWriter).writeBands(eq(KpProperties.Model.Variant.SEPARABLE_2D), anyList());
        verify(resultWriter, never()).writeDispersion(any(), anyList());
    }

    @Test
    @DisplayName("スキャン範囲や分割数が不正なら設定エラーになる")
    void run_rejectsInvalidScan() {
        properties.getScan().setSteps(0);
        assertThrows(IllegalStateException.class, () -> newRunner().run());

        properties.getScan().setSteps(10);
        properties.getScan().setEnergyMax(-1.0);
        assertThrows(IllegalStateException.class, () -> newRunner().run());
    }

    @Test
    @DisplayName("2 次元の点数が 0 なら設定エラーになる")
    void run_rejectsEmptyKGrid() {
        properties.getModel().setVariant(KpProperties.Model.Variant.SEPARABLE_2D);
        properties.getTwoDimensional().setNx(0);
        assertThrows(IllegalStateException.class, () -> newRunner().run());
    }
}
