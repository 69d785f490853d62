package mosaic.beamforming.model;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EquatorialTargetTest {

    @Test
    void describesInSexagesimal() {
        EquatorialTarget target = new EquatorialTarget("t", FastMath.toRadians(83.633), FastMath.toRadians(22.0145));
        assertEquals("radec, 5:34:31.92, 22:00:52.2", target.getDescription());
    }

    @Test
    void roundsWithoutSixtySeconds() {
        // 59.999秒应进位为下一分钟
        double ra = FastMath.toRadians((1.0 + 59.0 / 60.0 + 59.999 / 3600.0) * 15.0);
        EquatorialTarget target = new EquatorialTarget("t", ra, 0.0);
        assertEquals("radec, 2:00:00.00, 0:00:00.0", target.getDescription());
    }

    @Test
    void directionPointsToPole() {
        Vector3D direction = new EquatorialTarget("pole", 1.0, FastMath.PI / 2).getDirection();
        assertEquals(1.0, direction.getZ(), 1e-12);
    }

    @Test
    void rejectsDeclinationOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new EquatorialTarget("t", 0.0, 2.0));
    }

    @Test
    void normalizesRightAscension() {
        EquatorialTarget target = new EquatorialTarget("t", -FastMath.PI / 2, 0.0);
        assertEquals(270.0, target.getRightAscensionDegrees(), 1e-12);
    }
}
