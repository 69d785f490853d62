package mosaic.beamforming.model;

import mosaic.beamforming.InvalidInputTypeException;
import mosaic.helper.EarthModel;

import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.frames.TopocentricFrame;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AntennaGeometryTest {

    @Test
    void resolvesMixedInputsInOrder() {
        AntennaPosition named = new AntennaPosition("m010", -30.7, 21.4, 1040);
        GeodeticPoint point = new GeodeticPoint(FastMath.toRadians(-30.72), FastMath.toRadians(21.45), 1030);
        TopocentricFrame station = new TopocentricFrame(new EarthModel().getEarth(),
                new GeodeticPoint(FastMath.toRadians(-30.73), FastMath.toRadians(21.46), 1020), "m020");

        List<Object> inputs = Arrays.asList(
                new double[]{-30.71, 21.44, 1035},
                Arrays.asList(-30.72, 21.43, 1036),
                named,
                point,
                station
        );
        AntennaGeometry geometry = AntennaGeometry.of(inputs);

        assertEquals(5, geometry.size());
        assertEquals("ant0", geometry.get(0).getId());
        assertArrayEquals(new double[]{-30.71, 21.44, 1035}, geometry.get(0).toArray(), 0.0);
        assertEquals("ant1", geometry.get(1).getId());
        assertEquals(1036.0, geometry.get(1).getAltitude());
        assertSame(named, geometry.get(2));
        assertEquals("ant3", geometry.get(3).getId());
        assertEquals(-30.72, geometry.get(3).getLatitude(), 1e-12);
        assertEquals("m020", geometry.get(4).getId());
        assertEquals(21.46, geometry.get(4).getLongitude(), 1e-12);
        assertEquals(1020.0, geometry.get(4).getAltitude(), 1e-9);
    }

    @Test
    void isImmutable() {
        AntennaGeometry geometry = AntennaGeometry.of(Collections.singletonList(new double[]{-30.71, 21.44, 1035}));
        assertThrows(UnsupportedOperationException.class,
                () -> geometry.asList().add(new AntennaPosition("x", 0, 0, 0)));
        geometry.toArray()[0][0] = 0.0;
        assertEquals(-30.71, geometry.get(0).getLatitude());
    }

    @Test
    void rejectsUnrecognizedInputs() {
        assertThrows(InvalidInputTypeException.class, () -> AntennaGeometry.of(null));
        assertThrows(InvalidInputTypeException.class,
                () -> AntennaGeometry.of(Collections.singletonList("m000")));
        assertThrows(InvalidInputTypeException.class,
                () -> AntennaGeometry.of(Collections.singletonList(new double[]{-30.71, 21.44})));
        assertThrows(InvalidInputTypeException.class,
                () -> AntennaGeometry.of(Collections.singletonList(Arrays.asList(-30.71, "21.44", 1035))));
    }

    @Test
    void rejectsDuplicateIds() {
        AntennaPosition first = new AntennaPosition("m000", -30.71, 21.44, 1035);
        AntennaPosition second = new AntennaPosition("m000", -30.72, 21.45, 1035);
        assertThrows(IllegalArgumentException.class, () -> AntennaGeometry.of(Arrays.asList(first, second)));
    }

    @Test
    void geodeticRoundTrip() {
        AntennaPosition antenna = new AntennaPosition("m000", -30.71, 21.44, 1035);
        AntennaPosition copy = AntennaPosition.fromGeodeticPoint("m000", antenna.toGeodeticPoint());
        assertEquals(antenna.getLatitude(), copy.getLatitude(), 1e-12);
        assertEquals(antenna.getLongitude(), copy.getLongitude(), 1e-12);
        assertEquals(antenna.getAltitude(), copy.getAltitude(), 0.0);
    }
}
