package io.github.yok.kp.core.numeric;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * {@link BisectionRootFinder} の単体テストです。
 */
class BisectionRootFinderTest {

    @Test
    @DisplayName("符号反転のある区間で根を許容誤差内に求める")
    void findRoot_bracketedRoot() {
        BisectionRootFinder finder = new BisectionRootFinder(1e-10, 200);
        double root = finder.findRoot(x -> x * x - 2.0, 0.0, 2.0);
        assertEquals(Math.sqrt(2.0), root, 1e-9);
    }

    @Test
    @DisplayName("符号反転がなくても終了し、区間内の点を返す")
    void findRoot_withoutSignChange_staysInInterval() {
        BisectionRootFinder finder = new BisectionRootFinder(1e-8, 64);
        double root = finder.findRoot(x -> x * x + 1.0, -1.0, 3.0);
        assertTrue(root >= -1.0 && root <= 3.0);
    }

    @Test
    @DisplayName("反復回数の上限で打ち切る")
    void findRoot_stopsAtMaxIterations() {
        BisectionRootFinder finder = new BisectionRootFinder(0.0, 0);
        assertEquals(1.5, finder.findRoot(x -> x - 1.0, 0.0, 3.0));
    }
}
