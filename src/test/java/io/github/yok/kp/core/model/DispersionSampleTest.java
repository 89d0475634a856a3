package io.github.yok.kp.core.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link DispersionSample} の単体テストです。
 */
class DispersionSampleTest {

    @Test
    @DisplayName("許容帯の標本は ±k を持つ")
    void allowedSample_hasSymmetricWavenumbers() {
        DispersionRelation relation = new SimpleKronigPenneyModel(SimpleKpParameters.of(1.0, 0.5, 10.0));
        DispersionSample s = DispersionSample.of(relation, 15.0);

        assertTrue(s.isAllowed());
        assertEquals(Math.acos(s.getD()) / 3.0, s.kPlus(), 1e-12);
        assertEquals(-s.kPlus(), s.kMinus());
    }

    @Test
    @DisplayName("禁制帯の標本は D を丸めた主波数 0 を持つ")
    void forbiddenSample_clampsToZoneCenter() {
        DispersionRelation relation = new SimpleKronigPenneyModel(SimpleKpParameters.of(1.0, 0.5, 10.0));
        DispersionSample s = DispersionSample.of(relation, 5.0);

        assertFalse(s.isAllowed());
        assertEquals(0.0, s.getK());
    }
}
