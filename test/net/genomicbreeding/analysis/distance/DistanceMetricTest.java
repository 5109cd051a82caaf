/*
 *  DistanceMetricTest
 */
package net.genomicbreeding.analysis.distance;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistanceMetricTest {

    private static final double[] U = {1.0, 3.0, 0.0};
    private static final double[] V = {2.0, 5.0, 0.0};

    @Test
    void distancesOfKnownVectors() {
        assertEquals(Math.sqrt(5.0), DistanceMetric.EUCLIDEAN.compute(U, V), 1e-12);
        assertEquals(1.0, DistanceMetric.MAD.compute(U, V), 1e-12);
        assertEquals(Math.sqrt(5.0 / 3.0), DistanceMetric.RMSD.compute(U, V), 1e-12);
        assertEquals(1.3, DistanceMetric.CHI_SQUARE.compute(U, V), 1e-12);
        assertEquals(1.0 + 4.0 / 3.0, DistanceMetric.CHI_SQUARE.compute(V, U), 1e-12);
    }

    @Test
    void correlationOfKnownVectors() {
        assertEquals(1.0, DistanceMetric.CORRELATION.compute(U, U), 1e-12);
        assertEquals(-1.0, DistanceMetric.CORRELATION.compute(new double[]{1.0, 2.0, 3.0}, new double[]{6.0, 4.0, 2.0}), 1e-12);
    }

    @Test
    void correlationOfConstantVectorIsUndefined() {
        double[] constant = {2.0, 2.0, 2.0};
        assertEquals(DistanceMetric.UNDEFINED, DistanceMetric.CORRELATION.compute(constant, U));
        assertEquals(DistanceMetric.UNDEFINED, DistanceMetric.CORRELATION.compute(U, constant));
        assertEquals(DistanceMetric.UNDEFINED, DistanceMetric.CORRELATION.compute(constant, constant));
        assertEquals(0.0, DistanceMetric.EUCLIDEAN.compute(constant, constant));
    }

    @Test
    void namesResolve() {
        assertEquals(DistanceMetric.CHI_SQUARE, DistanceMetric.fromName("chi_square"));
        assertEquals(DistanceMetric.CHI_SQUARE, DistanceMetric.fromName("χ²"));
        assertEquals(DistanceMetric.MAD, DistanceMetric.fromName("mad"));
        assertNull(DistanceMetric.fromName("manhattan"));
        assertEquals("rmsd", DistanceMetric.RMSD.toString());
        assertEquals("euclidean, correlation, mad, rmsd, chi_square", DistanceMetric.recognisedNames());
    }

    @Test
    void resolveKeepsFirstOccurrenceOrder() {
        List<DistanceMetric> metrics = DistanceMetric.resolve(Arrays.asList("rmsd", "euclidean", "rmsd", "χ²", "chi_square"));
        assertEquals(Arrays.asList(DistanceMetric.RMSD, DistanceMetric.EUCLIDEAN, DistanceMetric.CHI_SQUARE), metrics);
    }

    @Test
    void resolveRejectsUnknownOrNoNames() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> DistanceMetric.resolve(Arrays.asList("euclidean", "manhattan")));
        assertTrue(e.getMessage().contains("manhattan"));
        assertTrue(e.getMessage().contains(DistanceMetric.recognisedNames()));
        assertThrows(IllegalArgumentException.class, () -> DistanceMetric.resolve(Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> DistanceMetric.resolve(null));
    }

}
