package mosaic.beamforming;

import mosaic.beamforming.calculator.OverlapCalculator;
import mosaic.beamforming.model.OverlapFractions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OverlapTest {

    @Test
    void heaterModeHasNoFractions() {
        Overlap overlap = new Overlap(new double[][]{{0.2, 1.4}, {0.0, 2.1}}, OverlapMode.HEATER);
        assertThrows(UnsupportedModeException.class, overlap::calculateFractions);
    }

    @Test
    void fractionsPartitionCounts() {
        Overlap overlap = new Overlap(new double[][]{{0, 1}, {2, 3}}, OverlapMode.COUNTER);
        OverlapFractions fractions = overlap.calculateFractions();
        assertEquals(0.5, fractions.getOverlapped(), 1e-15);
        assertEquals(0.25, fractions.getNonOverlapped(), 1e-15);
        assertEquals(0.25, fractions.getEmpty(), 1e-15);
    }

    @Test
    void fractionsSumToOneAtAnyResolution() {
        Tiling tiling = new TilingGenerator().generateNBeamsTiling(BeamShape.ofAxes(0.05, 0.03, 20.0), 12, 0.4);
        for (int gridSize : new int[]{2, 11, 37, 90}) {
            MosaicConfig config = new MosaicConfig();
            config.setOverlapGridSize(gridSize);
            OverlapFractions fractions = tiling.calculateOverlap(OverlapMode.COUNTER, null,
                    new OverlapCalculator(config)).calculateFractions();
            assertEquals(1.0, fractions.getOverlapped() + fractions.getNonOverlapped() + fractions.getEmpty(),
                    1e-12, "grid " + gridSize);
        }
    }

    @Test
    void metricsAreCopied() {
        double[][] metrics = {{1, 2}};
        Overlap overlap = new Overlap(metrics, OverlapMode.COUNTER);
        metrics[0][0] = 7;
        overlap.getMetrics()[0][1] = 9;
        assertEquals(1, overlap.getMetrics()[0][0]);
        assertEquals(2, overlap.getMetrics()[0][1]);
    }

    @Test
    void modeLabelsResolve() {
        assertEquals(OverlapMode.COUNTER, OverlapMode.fromLabel("Counter"));
        assertEquals(OverlapMode.HEATER, OverlapMode.fromLabel(" heater "));
        assertThrows(UnsupportedModeException.class, () -> OverlapMode.fromLabel("painter"));
        assertThrows(UnsupportedModeException.class, () -> OverlapMode.fromLabel(null));
    }
}
