package mosaic.beamforming.calculator;

import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.AntennaPosition;
import mosaic.beamforming.model.DelayCorrections;
import mosaic.beamforming.model.EquatorialTarget;
import mosaic.helper.EarthModel;
import mosaic.helper.SkyGeometry;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;
import org.orekit.utils.Constants;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 几何延迟校正
 *
 * 默认的延迟预言机：天线 j 相对参考点的几何延迟 τ_j(t) = -w_j(t) / c，
 * w 为天线偏移在目标方向上的投影。时间窗 [t0, t1] 内输出一段线性多项式
 * (τ(t0), (τ(t1) - τ(t0)) / (t1 - t0))。两个极化通道的几何延迟相同。
 */
public class GeometricDelayCorrection implements DelayCorrectionOracle {

    /** 极化后缀 */
    public static final String[] POLARIZATIONS = {"h", "v"};

    private final AntennaGeometry antennas;
    private final AntennaPosition reference;
    private final double frequency;
    // 各天线在参考点本地赤道坐标系中的偏移（米）
    private final double[][] equatorialOffsets;

    public GeometricDelayCorrection(AntennaGeometry antennas, AntennaPosition reference, double frequency) {
        this(antennas, reference, frequency, new EarthModel());
    }

    public GeometricDelayCorrection(AntennaGeometry antennas, AntennaPosition reference,
                                    double frequency, EarthModel earthModel) {
        if (!(frequency > 0)) {
            throw new IllegalArgumentException("frequency should be positive, got " + frequency);
        }
        this.antennas = antennas;
        this.reference = reference;
        this.frequency = frequency;

        double latitude = FastMath.toRadians(reference.getLatitude());
        double[][] enu = earthModel.enuOffsets(antennas, reference);
        this.equatorialOffsets = new double[enu.length][];
        for (int j = 0; j < enu.length; j++) {
            equatorialOffsets[j] = SkyGeometry.enuToEquatorial(enu[j], latitude);
        }
    }

    @Override
    public DelayCorrections corrections(EquatorialTarget target, double startEpoch, double endEpoch) {
        if (!(endEpoch > startEpoch)) {
            throw new IllegalArgumentException(
                "time window should have positive length: [" + startEpoch + ", " + endEpoch + "]");
        }
        double longitude = FastMath.toRadians(reference.getLongitude());
        double hourAngle0 = SkyGeometry.hourAngle(startEpoch, longitude, target.getRightAscension());
        double hourAngle1 = SkyGeometry.hourAngle(endEpoch, longitude, target.getRightAscension());
        double duration = endEpoch - startEpoch;
        double phaseScale = -MathUtils.TWO_PI * frequency;

        Map<String, double[][]> delays = new LinkedHashMap<>();
        Map<String, double[][]> phases = new LinkedHashMap<>();
        for (int j = 0; j < antennas.size(); j++) {
            double delay0 = geometricDelay(equatorialOffsets[j], hourAngle0, target.getDeclination());
            double delay1 = geometricDelay(equatorialOffsets[j], hourAngle1, target.getDeclination());
            double rate = (delay1 - delay0) / duration;

            for (String polarization : POLARIZATIONS) {
                String input = antennas.get(j).getId() + polarization;
                delays.put(input, new double[][]{{delay0, rate}});
                phases.put(input, new double[][]{{phaseScale * delay0, phaseScale * rate}});
            }
        }
        return new DelayCorrections(delays, phases);
    }

    public double getFrequency() {
        return frequency;
    }

    private static double geometricDelay(double[] offset, double hourAngle, double declination) {
        double w = SkyGeometry.toUvw(offset, hourAngle, declination)[2];
        return -w / Constants.SPEED_OF_LIGHT;
    }
}
