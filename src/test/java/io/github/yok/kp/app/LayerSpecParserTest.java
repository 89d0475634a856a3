package io.github.yok.kp.app;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.kp.core.transfer.Layer;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link LayerSpecParser} の単体テストです。
 */
class LayerSpecParserTest {

    @Test
    @DisplayName("井戸・障壁・数値だけの表記を入力順に読み取る")
    void parseLayers_mixedTokens() {
        List<Layer> layers = LayerSpecParser.parseLayers("b:0.4, U:12:0.2 ,0.3");

        assertEquals(3, layers.size());
        assertEquals(Layer.well(0.4), layers.get(0));
        assertEquals(new Layer(0.2, 12.0), layers.get(1));
        assertEquals(Layer.well(0.3), layers.get(2));
    }

    @Test
    @DisplayName("負のポテンシャルと空のトークンを扱える")
    void parseLayers_negativePotentialAndBlanks() {
        List<Layer> layers = LayerSpecParser.parseLayers("U:-3:0.5,,b:0.5,");

        assertEquals(2, layers.size());
        assertEquals(-3.0, layers.get(0).getPotential());
        assertEquals(0.5, layers.get(0).getWidth());
    }

    @Test
    @DisplayName("空文字列は空の層列になる")
    void parseLayers_empty() {
        assertTrue(LayerSpecParser.parseLayers("  ").isEmpty());
    }

    @Test
    @DisplayName("不正な表記は IllegalArgumentException になる")
    void parseLayers_rejectsMalformedTokens() {
        assertThrows(IllegalArgumentException.class, () -> LayerSpecParser.parseLayers(null));
        assertThrows(IllegalArgumentException.class, () -> LayerSpecParser.parseLayers("U:0.2"));
        assertThrows(IllegalArgumentException.class, () -> LayerSpecParser.parseLayers("b:x"));
        assertThrows(IllegalArgumentException.class,
                () -> LayerSpecParser.parseLayers("b:0.1:0.2"));
        assertThrows(IllegalArgumentException.class, () -> LayerSpecParser.parseLayers("well"));
    }
}
