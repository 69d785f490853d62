package mosaic.beamforming;

import mosaic.beamforming.calculator.DelayCorrectionOracle;
import mosaic.beamforming.calculator.EphemerisAdapter;
import mosaic.beamforming.calculator.GeometricDelayCorrection;
import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.AntennaPosition;
import mosaic.beamforming.model.DelayCorrections;
import mosaic.beamforming.model.EquatorialTarget;
import mosaic.beamforming.model.SkyPosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 延迟多项式
 *
 * 对每个目标方向查询延迟校正预言机，取每根天线的 (延迟, 变化率)，
 * 再整体减去第0个目标（指向中心）的值，使所有结果都是相对指向中心的偏移。
 * 输出中天线的顺序与输入阵列几何完全一致。
 */
public class DelayPolynomial {

    private static final Logger logger = Logger.getLogger(DelayPolynomial.class.getName());

    private final AntennaGeometry antennas;
    private final List<EquatorialTarget> targets;
    private final AntennaPosition reference;
    private final double frequency;
    private final MosaicConfig config;
    private final DelayCorrectionOracle.Factory oracleFactory;
    private final EphemerisAdapter ephemeris;

    /**
     * @param antennas 天线输入，见 {@link AntennaGeometry#of}
     * @param targets 波束方向，[赤经, 赤纬]（度）或目标句柄；第0个为指向中心
     * @param reference 参考天线：天线输入，或阵列中某根天线的标识
     */
    public DelayPolynomial(List<?> antennas, List<?> targets, Object reference) {
        this(antennas, targets, reference, new MosaicConfig(),
             GeometricDelayCorrection::new, new EphemerisAdapter());
    }

    public DelayPolynomial(List<?> antennas, List<?> targets, Object reference,
                           MosaicConfig config,
                           DelayCorrectionOracle.Factory oracleFactory,
                           EphemerisAdapter ephemeris) {
        this.antennas = AntennaGeometry.of(antennas);
        this.ephemeris = ephemeris;
        this.targets = checkTargets(targets, ephemeris);
        this.reference = checkReference(reference, this.antennas);
        this.frequency = config.getDelayReferenceFrequency();
        this.config = config;
        this.oracleFactory = oracleFactory;
    }

    /**
     * 把目标输入统一解析为目标句柄
     */
    static List<EquatorialTarget> checkTargets(List<?> targets, EphemerisAdapter ephemeris) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("at least one target is required");
        }
        List<EquatorialTarget> resolved = new ArrayList<>(targets.size());
        for (Object target : targets) {
            resolved.add(SkyPosition.of(target).resolve(ephemeris));
        }
        return Collections.unmodifiableList(resolved);
    }

    private static AntennaPosition checkReference(Object reference, AntennaGeometry antennas) {
        if (reference instanceof String) {
            for (AntennaPosition antenna : antennas) {
                if (antenna.getId().equals(reference)) {
                    return antenna;
                }
            }
            throw new InvalidInputTypeException("reference", "no antenna with id '" + reference + "'");
        }
        return AntennaGeometry.resolveAntenna(reference, "ref");
    }

    public double[][][] getDelayPolynomials(Object epoch) {
        return getDelayPolynomials(epoch, config.getDefaultDelayDuration());
    }

    /**
     * 计算延迟多项式
     *
     * @param epoch 起始时间，纪元秒或日期时间对象
     * @param duration 多项式有效时长（秒）
     * @return [目标][天线][{延迟, 变化率}]，均相对第0个目标
     */
    public double[][][] getDelayPolynomials(Object epoch, double duration) {
        if (!(duration > 0)) {
            throw new IllegalArgumentException("duration should be positive, got " + duration);
        }
        double timestamp = ephemeris.toEpochSeconds(epoch);
        DelayCorrectionOracle oracle = oracleFactory.create(antennas, reference, frequency);
        String polarization = config.getDelayPolarization();
        int segment = config.getDelaySegmentIndex();

        double[][][] targetArray = new double[targets.size()][antennas.size()][];
        for (int t = 0; t < targets.size(); t++) {
            DelayCorrections corrections = oracle.corrections(targets.get(t), timestamp, timestamp + duration);
            for (int a = 0; a < antennas.size(); a++) {
                // 只取一个极化、第一个时间段
                String input = antennas.get(a).getId() + polarization;
                double[][] polynomial = corrections.getDelays().get(input);
                if (polynomial == null || polynomial.length <= segment) {
                    throw new IllegalStateException("delay oracle returned no segment " + segment
                            + " for input " + input);
                }
                targetArray[t][a] = new double[]{polynomial[segment][0], polynomial[segment][1]};
            }
        }

        // 减去指向中心
        double[][] boreSight = new double[antennas.size()][];
        for (int a = 0; a < antennas.size(); a++) {
            boreSight[a] = targetArray[0][a].clone();
        }
        for (double[][] row : targetArray) {
            for (int a = 0; a < antennas.size(); a++) {
                row[a][0] -= boreSight[a][0];
                row[a][1] -= boreSight[a][1];
            }
        }

        logger.fine("delay polynomials for " + targets.size() + " targets x " + antennas.size() + " antennas");
        return targetArray;
    }

    public AntennaGeometry getAntennas() {
        return antennas;
    }

    public List<EquatorialTarget> getTargets() {
        return targets;
    }

    public AntennaPosition getReference() {
        return reference;
    }

    public double getFrequency() {
        return frequency;
    }
}
