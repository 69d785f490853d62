package mosaic.beamforming.calculator;

import mosaic.beamforming.MosaicConfig;
import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.AntennaPosition;
import mosaic.beamforming.model.BeamAxis;
import mosaic.beamforming.model.PointSpreadFunction;
import mosaic.helper.EarthModel;
import mosaic.helper.SkyGeometry;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.util.logging.Logger;

/**
 * 干涉阵观测
 *
 * 默认的观测引擎实现。把天线投影到垂直于指向的平面上，计算相干合成波束的
 * 功率方向图作为点扩散函数，再沿各方向追踪半功率轮廓，得到主瓣椭圆。
 *
 * 计算步骤：
 * 1. 天线相对参考点的ENU偏移（Orekit站心坐标系）
 * 2. 按时角和赤纬投影为 (u, v)
 * 3. P(l, m) = mean_λ |Σ exp(2πi(u·l + v·m)/λ)|² / N²
 * 4. 半功率轮廓：逐方向步进后二分
 *
 * 实例持有指向和时间状态，不是线程安全的。
 */
public class InterferometryObservation implements ObservationEngine {

    private static final Logger logger = Logger.getLogger(InterferometryObservation.class.getName());

    private static final double HALF_POWER = 0.5;
    // 每个主瓣宽度（λ/B）内的步进数
    private static final int STEPS_PER_LOBE = 64;
    private static final int BISECTION_ITERATIONS = 50;
    // 方向余弦的物理上限
    private static final double MAX_DIRECTION_COSINE = 1.0;

    private final AntennaPosition reference;
    private final double[] wavelengths;
    private final int imageSize;
    private final double fieldScale;
    private final int angleSteps;
    private final EarthModel earthModel;

    // 观测状态
    private double rightAscension = Double.NaN;  // 弧度
    private double declination = Double.NaN;     // 弧度
    private double epochSeconds = Double.NaN;

    // 计算结果
    private double[] u;
    private double[] v;
    private BeamAxis beamAxis;
    private double[] horizontal;
    private PointSpreadFunction pointSpreadFunction;

    /**
     * 创建观测（使用默认配置）
     */
    public InterferometryObservation(AntennaPosition reference, double... wavelengths) {
        this(reference, wavelengths, new MosaicConfig());
    }

    public InterferometryObservation(AntennaPosition reference, double[] wavelengths, MosaicConfig config) {
        this(reference, wavelengths, config.getPsfImageSize(), config.getPsfFieldScale(),
             config.getContourAngleSteps(), new EarthModel());
    }

    /**
     * 创建观测
     *
     * @param reference 阵列参考点
     * @param wavelengths 观测波长（米），多个波长时方向图取平均
     * @param imageSize PSF栅格每边像素数
     * @param fieldScale PSF栅格半宽，以半长轴为单位
     * @param angleSteps 在 [0°, 180°) 内追踪轮廓的方向数
     * @param earthModel 地球模型
     */
    public InterferometryObservation(AntennaPosition reference,
                                     double[] wavelengths,
                                     int imageSize,
                                     double fieldScale,
                                     int angleSteps,
                                     EarthModel earthModel) {
        if (wavelengths.length == 0) {
            throw new IllegalArgumentException("at least one wavelength is required");
        }
        for (double wavelength : wavelengths) {
            if (!(wavelength > 0)) {
                throw new IllegalArgumentException("wavelength should be positive, got " + wavelength);
            }
        }
        if (imageSize < 1 || angleSteps < 1 || !(fieldScale > 0)) {
            throw new IllegalArgumentException("invalid PSF raster settings: imageSize=" + imageSize
                    + ", angleSteps=" + angleSteps + ", fieldScale=" + fieldScale);
        }
        this.reference = reference;
        this.wavelengths = wavelengths.clone();
        this.imageSize = imageSize;
        this.fieldScale = fieldScale;
        this.angleSteps = angleSteps;
        this.earthModel = earthModel;
    }

    @Override
    public void setBoreSight(double rightAscension, double declination) {
        this.rightAscension = FastMath.toRadians(rightAscension);
        this.declination = FastMath.toRadians(declination);
    }

    @Override
    public void setObserveTime(double epochSeconds) {
        this.epochSeconds = epochSeconds;
    }

    @Override
    public void createContour(AntennaGeometry antennas) {
        if (Double.isNaN(rightAscension) || Double.isNaN(epochSeconds)) {
            throw new IllegalStateException("bore sight and observe time must be set before createContour");
        }

        double latitude = FastMath.toRadians(reference.getLatitude());
        double hourAngle = SkyGeometry.hourAngle(
            epochSeconds, FastMath.toRadians(reference.getLongitude()), rightAscension
        );

        // 1. 投影天线位置
        double[][] enu = earthModel.enuOffsets(antennas, reference);
        u = new double[enu.length];
        v = new double[enu.length];
        for (int j = 0; j < enu.length; j++) {
            double[] uvw = SkyGeometry.toUvw(
                SkyGeometry.enuToEquatorial(enu[j], latitude), hourAngle, declination
            );
            u[j] = uvw[0];
            v[j] = uvw[1];
        }

        // 2. 地平坐标
        horizontal = SkyGeometry.toHorizontal(hourAngle, declination, latitude);
        if (horizontal[1] < 0) {
            logger.warning(String.format("bore sight is below the horizon (elevation %.2f deg)",
                    FastMath.toDegrees(horizontal[1])));
        }

        // 3. 半功率轮廓
        double maxBaseline = maxProjectedBaseline();
        if (maxBaseline == 0.0) {
            throw new IllegalStateException("projected array has no extent, cannot form a beam");
        }
        double step = minWavelength() / maxBaseline / STEPS_PER_LOBE;

        double major = -1.0;
        double minor = Double.MAX_VALUE;
        double majorDirection = 0.0;
        for (int k = 0; k < angleSteps; k++) {
            double theta = FastMath.PI * k / angleSteps;
            double radius = halfPowerRadius(FastMath.cos(theta), FastMath.sin(theta), step);
            if (radius > major) {
                major = radius;
                majorDirection = theta;
            }
            minor = FastMath.min(minor, radius);
        }
        beamAxis = new BeamAxis(
            FastMath.toDegrees(major),
            FastMath.toDegrees(minor),
            FastMath.toDegrees(majorDirection)
        );

        // 4. PSF栅格
        pointSpreadFunction = renderImage(beamAxis.getAxisH());

        logger.fine("contour created for " + antennas.size() + " antennas: " + beamAxis);
    }

    @Override
    public BeamAxis getBeamAxis() {
        requireContour();
        return beamAxis;
    }

    @Override
    public double[] getHorizontal() {
        requireContour();
        return horizontal.clone();
    }

    @Override
    public PointSpreadFunction getPointSpreadFunction() {
        requireContour();
        return pointSpreadFunction;
    }

    /**
     * 归一化功率方向图
     *
     * @param l 东向方向余弦
     * @param m 北向方向余弦
     */
    double power(double l, double m) {
        double total = 0.0;
        int n = u.length;
        for (double wavelength : wavelengths) {
            double re = 0.0;
            double im = 0.0;
            double k = MathUtils.TWO_PI / wavelength;
            for (int j = 0; j < n; j++) {
                double phase = k * (u[j] * l + v[j] * m);
                re += FastMath.cos(phase);
                im += FastMath.sin(phase);
            }
            total += (re * re + im * im) / ((double) n * n);
        }
        return total / wavelengths.length;
    }

    /**
     * 沿 (cx, cy) 方向找到功率首次降到一半的半径
     */
    private double halfPowerRadius(double cx, double cy, double step) {
        double inner = 0.0;
        long maxSteps = (long) FastMath.ceil(MAX_DIRECTION_COSINE / step);
        for (long s = 1; s <= maxSteps; s++) {
            double outer = s * step;
            if (power(outer * cx, outer * cy) < HALF_POWER) {
                for (int i = 0; i < BISECTION_ITERATIONS; i++) {
                    double mid = 0.5 * (inner + outer);
                    if (power(mid * cx, mid * cy) < HALF_POWER) {
                        outer = mid;
                    } else {
                        inner = mid;
                    }
                }
                return 0.5 * (inner + outer);
            }
            inner = outer;
        }
        throw new IllegalStateException(String.format(
            "half-power contour is not closed along direction (%.4f, %.4f)", cx, cy));
    }

    private PointSpreadFunction renderImage(double axisH) {
        double width = 2.0 * fieldScale * axisH;
        double pixel = width / imageSize;
        double[][] image = new double[imageSize][imageSize];
        for (int i = 0; i < imageSize; i++) {
            double m = FastMath.toRadians(width / 2.0 - (i + 0.5) * pixel);
            for (int j = 0; j < imageSize; j++) {
                double l = FastMath.toRadians(-width / 2.0 + (j + 0.5) * pixel);
                image[i][j] = power(l, m);
            }
        }
        return new PointSpreadFunction(
            image,
            new double[]{FastMath.toDegrees(rightAscension), FastMath.toDegrees(declination)},
            width
        );
    }

    private double maxProjectedBaseline() {
        double max = 0.0;
        for (int i = 0; i < u.length; i++) {
            for (int j = i + 1; j < u.length; j++) {
                max = FastMath.max(max, FastMath.hypot(u[i] - u[j], v[i] - v[j]));
            }
        }
        return max;
    }

    private double minWavelength() {
        double min = Double.MAX_VALUE;
        for (double wavelength : wavelengths) {
            min = FastMath.min(min, wavelength);
        }
        return min;
    }

    private void requireContour() {
        if (beamAxis == null) {
            throw new IllegalStateException("createContour has not been called");
        }
    }
}
