package mosaic.beamforming.calculator;

import mosaic.beamforming.model.PackingResult;

import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EllipsePackerTest {

    private final EllipsePacker packer = new EllipsePacker();

    @Test
    void sevenCircularBeamsFormCentredHexagon() {
        PackingResult result = packer.compact(7, 0.1, 0.1, 0.0, 3);

        assertEquals(7, result.size());
        assertEquals(0.3, result.getRadius(), 1e-9);
        double[][] coordinates = result.getCoordinates();
        assertEquals(0.0, coordinates[0][0], 1e-12);
        assertEquals(0.0, coordinates[0][1], 1e-12);
        for (int i = 1; i < 7; i++) {
            assertEquals(0.2, FastMath.hypot(coordinates[i][0], coordinates[i][1]), 1e-9);
        }
    }

    @Test
    void singleBeamRadiusIsHalfWidth() {
        PackingResult result = packer.compact(1, 0.08, 0.03, 15.0, 2);
        assertEquals(1, result.size());
        assertEquals(0.08, result.getRadius(), 1e-12);
    }

    @Test
    void ellipticalBeamsDoNotOverlapBeyondRequestedLevel() {
        double widthH = 0.2;
        double widthV = 0.05;
        double angle = 30.0;
        double[][] coordinates = packer.compact(19, widthH, widthV, angle, 4).getCoordinates();

        assertEquals(19, coordinates.length);
        double cos = FastMath.cos(FastMath.toRadians(angle));
        double sin = FastMath.sin(FastMath.toRadians(angle));
        for (int i = 0; i < coordinates.length; i++) {
            for (int j = i + 1; j < coordinates.length; j++) {
                double dx = coordinates[i][0] - coordinates[j][0];
                double dy = coordinates[i][1] - coordinates[j][1];
                double along = (dx * cos + dy * sin) / widthH;
                double across = (-dx * sin + dy * cos) / widthV;
                // 归一化坐标中相邻波束间距为2
                assertTrue(FastMath.hypot(along, across) >= 2.0 - 1e-9);
            }
        }
    }

    @Test
    void coordinatesAreOrderedByDistance() {
        double[][] coordinates = packer.compact(40, 0.1, 0.06, 70.0, 3).getCoordinates();
        for (int i = 1; i < coordinates.length; i++) {
            double previous = FastMath.hypot(coordinates[i - 1][0], coordinates[i - 1][1]);
            double current = FastMath.hypot(coordinates[i][0], coordinates[i][1]);
            assertTrue(current >= previous - 1e-9);
        }
    }

    @Test
    void compactIsDeterministic() {
        double[][] first = packer.compact(12, 0.1, 0.07, 10.0, 3).getCoordinates();
        double[][] second = packer.compact(12, 0.1, 0.07, 10.0, 3).getCoordinates();
        for (int i = 0; i < first.length; i++) {
            assertEquals(first[i][0], second[i][0]);
            assertEquals(first[i][1], second[i][1]);
        }
    }

    @Test
    void gridKeepsOnlyPointsInsideRadius() {
        double[][] coordinates = packer.grid(0.5, 0.1, 0.05, 45.0);
        assertTrue(coordinates.length > 7);
        for (double[] c : coordinates) {
            assertTrue(FastMath.hypot(c[0], c[1]) <= 0.5 + 1e-9);
        }
        assertEquals(0.0, FastMath.hypot(coordinates[0][0], coordinates[0][1]), 1e-12);
    }

    @Test
    void gridOfZeroRadiusHoldsOrigin() {
        assertEquals(1, packer.grid(0.0, 0.1, 0.1, 0.0).length);
    }

    @Test
    void gridIncludesPointsOnTheBoundary() {
        // 圆形波束半宽0.1，第一圈邻居距离正好为0.2
        assertEquals(7, packer.grid(0.2, 0.1, 0.1, 0.0).length);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> packer.compact(0, 0.1, 0.1, 0, 3));
        assertThrows(IllegalArgumentException.class, () -> packer.compact(3, 0.1, 0.1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> packer.compact(3, 0.0, 0.1, 0, 3));
        assertThrows(IllegalArgumentException.class, () -> packer.grid(-1.0, 0.1, 0.1, 0));
        assertThrows(IllegalArgumentException.class, () -> packer.grid(1.0, 0.1, -0.1, 0));
    }
}
