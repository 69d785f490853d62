package mosaic.beamforming.model;

import mosaic.beamforming.InvalidInputTypeException;
import mosaic.beamforming.calculator.EphemerisAdapter;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SkyPositionTest {

    private final EphemerisAdapter ephemeris = new EphemerisAdapter();

    @Test
    void literalArrayResolvesThroughEphemeris() {
        SkyPosition position = SkyPosition.of(new double[]{83.6, 22.0});
        assertTrue(position instanceof SkyPosition.Literal);

        EquatorialTarget target = position.resolve(ephemeris);
        assertEquals(83.6, target.getRightAscensionDegrees(), 1e-12);
        assertEquals(22.0, target.getDeclinationDegrees(), 1e-12);
    }

    @Test
    void numberListIsLiteral() {
        SkyPosition position = SkyPosition.of(Arrays.asList(83.6, 22));
        SkyPosition.Literal literal = (SkyPosition.Literal) position;
        assertEquals(83.6, literal.getRightAscension());
        assertEquals(22.0, literal.getDeclination());
    }

    @Test
    void handleResolvesToItself() {
        EquatorialTarget target = new EquatorialTarget("Crab", 1.459, 0.384);
        SkyPosition position = SkyPosition.of(target);
        assertTrue(position instanceof SkyPosition.Handle);
        assertSame(target, position.resolve(ephemeris));
        assertSame(position, SkyPosition.of(position));
    }

    @Test
    void rejectsOtherInputs() {
        assertThrows(InvalidInputTypeException.class, () -> SkyPosition.of("Crab"));
        assertThrows(InvalidInputTypeException.class, () -> SkyPosition.of(null));
        assertThrows(InvalidInputTypeException.class, () -> SkyPosition.of(new double[]{1.0, 2.0, 3.0}));
        assertThrows(InvalidInputTypeException.class, () -> SkyPosition.of(Arrays.asList("a", "b")));
        assertThrows(InvalidInputTypeException.class,
                () -> SkyPosition.ofDegrees(10.0, 95.0).resolve(ephemeris));
    }
}
