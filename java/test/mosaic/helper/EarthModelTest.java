package mosaic.helper;

import mosaic.beamforming.model.AntennaPosition;

import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EarthModelTest {

    private static final AntennaPosition REFERENCE = new AntennaPosition("ref", -30.71106, 21.44389, 1035);

    private final EarthModel earthModel = new EarthModel();

    @Test
    void northOffsetIsAboutHundredMetres() {
        AntennaPosition north = new AntennaPosition("n", -30.71006, 21.44389, 1035);
        double[] enu = earthModel.enuOffset(north, REFERENCE);
        assertTrue(enu[1] > 110.0 && enu[1] < 111.5);
        assertEquals(0.0, enu[0], 1e-6);
        assertTrue(FastMath.abs(enu[2]) < 0.01);
    }

    @Test
    void eastOffsetShrinksWithLatitude() {
        AntennaPosition east = new AntennaPosition("e", -30.71106, 21.44489, 1035);
        double[] enu = earthModel.enuOffset(east, REFERENCE);
        assertEquals(111.32 * FastMath.cos(FastMath.toRadians(30.71106)), enu[0], 0.5);
        assertEquals(0.0, enu[1], 0.01);
    }

    @Test
    void altitudeIsUp() {
        AntennaPosition up = new AntennaPosition("u", -30.71106, 21.44389, 1045);
        double[] enu = earthModel.enuOffset(up, REFERENCE);
        assertEquals(10.0, enu[2], 1e-6);
        assertEquals(0.0, enu[0], 1e-6);
        assertEquals(0.0, enu[1], 1e-6);
    }

    @Test
    void batchOffsetsKeepOrder() {
        double[][] offsets = earthModel.enuOffsets(Arrays.asList(
                REFERENCE,
                new AntennaPosition("u", -30.71106, 21.44389, 1045)
        ), REFERENCE);
        assertEquals(2, offsets.length);
        assertEquals(0.0, offsets[0][2], 0.0);
        assertEquals(10.0, offsets[1][2], 1e-6);
    }

    @Test
    void topocentricFrameIsNamedAfterReference() {
        assertNotNull(earthModel.getEarth());
        assertEquals("ref", earthModel.topocentric(REFERENCE).getName());
    }
}
