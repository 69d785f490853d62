package mosaic.beamforming;

import mosaic.beamforming.calculator.ObservationEngine;
import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.BeamAxis;
import mosaic.beamforming.model.PointSpreadFunction;

import org.hipparchus.util.FastMath;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PsfSimTest {

    @Test
    void drivesEngineInOrderAndConvertsHorizon() {
        RecordingEngine engine = new RecordingEngine();
        PsfSim psfSim = new PsfSim(ArrayFixtures.antennas(3), engine);

        BeamShape shape = psfSim.getBeamShape(new double[]{150.0, -20.0}, Instant.ofEpochSecond(1_500_000_000L));

        assertEquals(Arrays.asList("setBoreSight", "setObserveTime", "createContour",
                "getBeamAxis", "getHorizontal", "getPointSpreadFunction"), engine.calls);
        assertEquals(150.0, engine.rightAscension, 1e-12);
        assertEquals(-20.0, engine.declination, 1e-12);
        assertEquals(1.5e9, engine.epochSeconds);
        assertEquals(3, engine.antennaCount);

        assertEquals(0.2, shape.getAxisH());
        assertEquals(0.1, shape.getAxisV());
        assertEquals(30.0, shape.getAngle());
        assertArrayEquals(new double[]{180.0, 45.0}, shape.getHorizon(), 1e-12);
        assertArrayEquals(new double[]{150.0, -20.0}, shape.getBoreSight(), 1e-12);
        assertSame(engine.psf, shape.getPsf());
        assertSame(PsfSim.REFERENCE_ANTENNA, shape.getReferenceAntenna());
        assertEquals(3, shape.getAntennas().size());
    }

    @Test
    void rejectsTooFewAntennasBeforeTouchingEngine() {
        RecordingEngine engine = new RecordingEngine();
        PsfSim psfSim = new PsfSim(ArrayFixtures.antennas(2), engine);

        InsufficientAntennasException e = assertThrows(InsufficientAntennasException.class,
                () -> psfSim.getBeamShape(new double[]{150.0, -20.0}, ArrayFixtures.EPOCH));
        assertEquals(2, e.getAntennaCount());
        assertTrue(engine.calls.isEmpty());
    }

    @Test
    void rejectsUnknownInputTypes() {
        PsfSim psfSim = new PsfSim(ArrayFixtures.antennas(3), new RecordingEngine());
        assertThrows(InvalidInputTypeException.class,
                () -> psfSim.getBeamShape("Sgr A*", ArrayFixtures.EPOCH));
        assertThrows(InvalidInputTypeException.class,
                () -> psfSim.getBeamShape(new double[]{150.0, -20.0}, "2017-07-14"));
        assertThrows(InvalidInputTypeException.class,
                () -> new PsfSim(Arrays.asList("m000", "m001", "m002"), new RecordingEngine()));
    }

    @Test
    void interferometryEngineProducesOrderedAxes() {
        PsfSim psfSim = new PsfSim(ArrayFixtures.antennas(3), ArrayFixtures.fastConfig(), ArrayFixtures.FREQUENCY);

        BeamShape shape = psfSim.getBeamShape(ArrayFixtures.zenithBoreSight(), ArrayFixtures.EPOCH);

        assertTrue(shape.getAxisV() > 0);
        assertTrue(shape.getAxisH() >= shape.getAxisV());
        assertTrue(shape.getHorizon()[1] > 85.0);
        assertNotNull(shape.getPsf());
        assertEquals(16, shape.getPsf().getImage().length);
    }

    @Test
    void higherFrequencyGivesNarrowerBeam() {
        List<double[]> antennas = ArrayFixtures.antennas(4);
        MosaicConfig config = ArrayFixtures.fastConfig();
        BeamShape low = new PsfSim(antennas, config, 1.0e9)
                .getBeamShape(ArrayFixtures.zenithBoreSight(), ArrayFixtures.EPOCH);
        BeamShape high = new PsfSim(antennas, config, 2.0e9)
                .getBeamShape(ArrayFixtures.zenithBoreSight(), ArrayFixtures.EPOCH);
        assertEquals(2.0, low.getAxisH() / high.getAxisH(), 1e-3);
    }

    private static final class RecordingEngine implements ObservationEngine {
        final List<String> calls = new ArrayList<>();
        final PointSpreadFunction psf = new PointSpreadFunction(new double[][]{{1.0}}, new double[]{0, 0}, 0.1);
        double rightAscension;
        double declination;
        double epochSeconds;
        int antennaCount;

        @Override
        public void setBoreSight(double rightAscension, double declination) {
            calls.add("setBoreSight");
            this.rightAscension = rightAscension;
            this.declination = declination;
        }

        @Override
        public void setObserveTime(double epochSeconds) {
            calls.add("setObserveTime");
            this.epochSeconds = epochSeconds;
        }

        @Override
        public void createContour(AntennaGeometry antennas) {
            calls.add("createContour");
            this.antennaCount = antennas.size();
        }

        @Override
        public BeamAxis getBeamAxis() {
            calls.add("getBeamAxis");
            return new BeamAxis(0.2, 0.1, 30.0);
        }

        @Override
        public double[] getHorizontal() {
            calls.add("getHorizontal");
            return new double[]{FastMath.PI, FastMath.PI / 4};
        }

        @Override
        public PointSpreadFunction getPointSpreadFunction() {
            calls.add("getPointSpreadFunction");
            return psf;
        }
    }
}
