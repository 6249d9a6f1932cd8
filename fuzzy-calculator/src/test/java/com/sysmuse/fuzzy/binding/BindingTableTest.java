package com.sysmuse.fuzzy.binding;

import com.sysmuse.fuzzy.UndeclaredVariableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class BindingTableTest {

    private BindingTable table;

    @BeforeEach
    public void setup() {
        table = new BindingTable(7L)
                .put("x", 1.5)
                .put("R2", 10, "k")
                .put("C", new UniformTolerance(100e-9, 0.1));
    }

    @Test
    public void testFixedValues() {
        assertEquals(1.5, table.resolve("x"), 0.0);
        assertEquals(10000.0, table.resolve("R2"), 1e-9);
        assertEquals(List.of("x", "R2", "C"), List.copyOf(table.getNames()));
    }

    @Test
    public void testUndeclaredVariable() {
        UndeclaredVariableException e = assertThrows(UndeclaredVariableException.class, () -> table.resolve("y"));
        assertEquals("y", e.getVariable());
    }

    @Test
    public void testResolveDrawsEveryTime() {
        double first = table.resolve("C");
        double second = table.resolve("C");
        assertNotEquals(first, second);
        assertTrue(first >= 90e-9 && first <= 110e-9);
    }

    @Test
    public void testSnapshotIsFixed() {
        BindingTable snapshot = table.snapshot();
        double value = snapshot.resolve("C");
        assertEquals(value, snapshot.resolve("C"), 0.0);
        assertEquals(1.5, snapshot.resolve("x"), 0.0);
        assertTrue(snapshot.getSource("C") instanceof FixedValue);
    }

    @Test
    public void testSameSeedSameDraws() {
        BindingTable other = new BindingTable(7L).put("C", new UniformTolerance(100e-9, 0.1));
        BindingTable mine = new BindingTable(7L).put("C", new UniformTolerance(100e-9, 0.1));
        for (int i = 0; i < 10; i++) {
            assertEquals(mine.resolve("C"), other.resolve("C"), 0.0);
        }
    }

    @Test
    public void testCopyIsIndependent() {
        BindingTable copy = table.copy();
        copy.put("extra", 2);
        assertTrue(copy.contains("extra"));
        assertFalse(table.contains("extra"));
        assertEquals(table.size() + 1, copy.size());
    }

    @Test
    public void testNominal() {
        assertEquals(100e-9, table.nominal().resolve("C"), 0.0);
    }

    @Test
    public void testGaussianSpread() {
        GaussianTolerance source = new GaussianTolerance(1000, 0.03);
        assertEquals(10.0, source.getSigma(), 1e-12);
        Random random = new Random(1);
        double sum = 0;
        int n = 20000;
        for (int i = 0; i < n; i++) {
            sum += source.sample(random);
        }
        assertEquals(1000.0, sum / n, 0.5);
    }

    @Test
    public void testUniformBounds() {
        UniformTolerance source = new UniformTolerance(50, 0.2);
        Random random = new Random(3);
        for (int i = 0; i < 1000; i++) {
            double v = source.sample(random);
            assertTrue(v >= 40 && v <= 60, Double.toString(v));
        }
        assertThrows(IllegalArgumentException.class, () -> new UniformTolerance(1, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new GaussianTolerance(1, -0.1));
    }

    @Test
    public void testSiPrefix() {
        assertEquals(1e-15, SiPrefix.fromSymbol("f").getFactor(), 0.0);
        assertEquals(1e-3, SiPrefix.fromSymbol("m").getFactor(), 0.0);
        assertEquals(1e6, SiPrefix.fromSymbol("M").getFactor(), 0.0);
        assertEquals(SiPrefix.MICRO, SiPrefix.fromSymbol("u"));
        assertEquals(SiPrefix.NONE, SiPrefix.fromSymbol(""));
        assertEquals(SiPrefix.NONE, SiPrefix.fromSymbol(null));
        assertEquals(4700.0, SiPrefix.KILO.apply(4.7), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> SiPrefix.fromSymbol("x"));
    }
}
