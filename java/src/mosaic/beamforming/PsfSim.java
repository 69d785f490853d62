package mosaic.beamforming;

import mosaic.beamforming.calculator.EphemerisAdapter;
import mosaic.beamforming.calculator.InterferometryObservation;
import mosaic.beamforming.calculator.ObservationEngine;
import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.AntennaPosition;
import mosaic.beamforming.model.BeamAxis;
import mosaic.beamforming.model.EquatorialTarget;
import mosaic.beamforming.model.PointSpreadFunction;
import mosaic.beamforming.model.SkyPosition;

import org.hipparchus.util.FastMath;
import org.orekit.utils.Constants;

import java.util.List;
import java.util.logging.Logger;

/**
 * 波束形状模拟
 *
 * 把天线和目标输入规范化后驱动观测引擎：设置指向、设置时间、计算轮廓，
 * 再读取主瓣椭圆、地平坐标和点扩散函数。
 */
public class PsfSim {

    private static final Logger logger = Logger.getLogger(PsfSim.class.getName());

    /** 阵列参考点（纬度、经度、海拔） */
    public static final AntennaPosition REFERENCE_ANTENNA =
        new AntennaPosition("ref", -30.71106, 21.44389, 1035);

    /** 拟合椭圆所需的最少天线数 */
    public static final int MIN_ANTENNAS = 3;

    private final AntennaGeometry antennas;
    private final ObservationEngine observation;
    private final EphemerisAdapter ephemeris;

    /**
     * @param antennas 天线输入，见 {@link AntennaGeometry#of}
     * @param frequencies 观测频率（Hz）
     */
    public PsfSim(List<?> antennas, double... frequencies) {
        this(antennas, new MosaicConfig(), frequencies);
    }

    public PsfSim(List<?> antennas, MosaicConfig config, double... frequencies) {
        this(antennas, new InterferometryObservation(REFERENCE_ANTENNA, toWavelengths(frequencies), config));
    }

    public PsfSim(List<?> antennas, ObservationEngine observation) {
        this(antennas, observation, new EphemerisAdapter());
    }

    public PsfSim(List<?> antennas, ObservationEngine observation, EphemerisAdapter ephemeris) {
        this.antennas = AntennaGeometry.of(antennas);
        this.observation = observation;
        this.ephemeris = ephemeris;
    }

    /**
     * 频率转波长 λ = c / f
     */
    public static double[] toWavelengths(double... frequencies) {
        if (frequencies.length == 0) {
            throw new IllegalArgumentException("at least one frequency is required");
        }
        double[] wavelengths = new double[frequencies.length];
        for (int i = 0; i < frequencies.length; i++) {
            if (!(frequencies[i] > 0)) {
                throw new IllegalArgumentException("frequency should be positive, got " + frequencies[i]);
            }
            wavelengths[i] = Constants.SPEED_OF_LIGHT / frequencies[i];
        }
        return wavelengths;
    }

    public AntennaGeometry getAntennas() {
        return antennas;
    }

    /**
     * 计算当前观测参数下的波束形状（主瓣近似为椭圆）
     *
     * @param source 指向，[赤经, 赤纬]（度）或目标句柄
     * @param time 观测时间，纪元秒或日期时间对象
     * @return 波束形状，轴长和方向角均为度
     * @throws InsufficientAntennasException 天线少于3根
     */
    public BeamShape getBeamShape(Object source, Object time) {
        if (antennas.size() < MIN_ANTENNAS) {
            throw new InsufficientAntennasException(antennas.size(), MIN_ANTENNAS);
        }
        EquatorialTarget target = SkyPosition.of(source).resolve(ephemeris);
        double epochSeconds = ephemeris.toEpochSeconds(time);
        double[] boreSight = {target.getRightAscensionDegrees(), target.getDeclinationDegrees()};

        BeamAxis axis;
        double[] horizontal;
        PointSpreadFunction psf;
        // 引擎有状态：设置与读取之间独占
        synchronized (observation) {
            observation.setBoreSight(boreSight[0], boreSight[1]);
            observation.setObserveTime(epochSeconds);
            observation.createContour(antennas);
            axis = observation.getBeamAxis();
            horizontal = observation.getHorizontal();
            psf = observation.getPointSpreadFunction();
        }

        double[] horizon = {FastMath.toDegrees(horizontal[0]), FastMath.toDegrees(horizontal[1])};
        logger.fine("beam shape at " + target.getDescription() + ": " + axis);
        return new BeamShape(axis.getAxisH(), axis.getAxisV(), axis.getAngle(),
                psf, antennas, boreSight, REFERENCE_ANTENNA, horizon);
    }
}
