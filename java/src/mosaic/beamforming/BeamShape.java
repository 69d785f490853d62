package mosaic.beamforming;

import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.AntennaPosition;
import mosaic.beamforming.model.BeamWidth;
import mosaic.beamforming.model.PointSpreadFunction;

import org.hipparchus.util.FastMath;

import java.util.Collections;

/**
 * 波束形状
 *
 * 主瓣的椭圆近似以及得到它的点扩散函数、阵列快照和指向信息。
 * 每个 (阵列, 目标, 时间) 组合创建一次，之后不再修改；
 * 派生量都是字段的纯函数。
 */
public final class BeamShape {

    /**
     * 半高全宽与标准差之比 2·√(2·ln 2)
     *
     * @see <a href="https://en.wikipedia.org/wiki/Full_width_at_half_maximum">Full width at half maximum</a>
     */
    public static final double FWHM_PER_SIGMA = 2.3548200450309493;

    private final double axisH;
    private final double axisV;
    private final double angle;
    private final PointSpreadFunction psf;
    private final AntennaGeometry antennas;
    private final double[] boreSight;
    private final AntennaPosition referenceAntenna;
    private final double[] horizon;

    /**
     * 创建波束形状
     *
     * @param axisH 半长轴（度）
     * @param axisV 半短轴（度）
     * @param angle 长轴方向（度）
     * @param psf 点扩散函数
     * @param antennas 计算所用的阵列快照
     * @param boreSight 指向 [赤经, 赤纬]（度）
     * @param referenceAntenna 阵列参考点
     * @param horizon 指向的地平坐标 [方位角, 仰角]（度）
     */
    public BeamShape(double axisH, double axisV, double angle,
                     PointSpreadFunction psf,
                     AntennaGeometry antennas,
                     double[] boreSight,
                     AntennaPosition referenceAntenna,
                     double[] horizon) {
        if (!(axisV >= 0) || !(axisH >= axisV)) {
            throw new IllegalArgumentException(
                "beam axes should satisfy axisH >= axisV >= 0, got " + axisH + ", " + axisV);
        }
        this.axisH = axisH;
        this.axisV = axisV;
        this.angle = angle;
        this.psf = psf;
        this.antennas = antennas;
        this.boreSight = boreSight.clone();
        this.referenceAntenna = referenceAntenna;
        this.horizon = horizon == null ? null : horizon.clone();
    }

    /**
     * 仅由椭圆参数构造的波束形状，没有PSF、阵列快照和地平坐标，
     * 用于以替代形状重新计算重叠
     */
    public static BeamShape ofAxes(double axisH, double axisV, double angle) {
        return ofAxes(axisH, axisV, angle, new double[]{0.0, 0.0});
    }

    public static BeamShape ofAxes(double axisH, double axisV, double angle, double[] boreSight) {
        return new BeamShape(axisH, axisV, angle, null,
                new AntennaGeometry(Collections.<AntennaPosition>emptyList()),
                boreSight, PsfSim.REFERENCE_ANTENNA, null);
    }

    /**
     * 给定重叠度下沿长轴、短轴方向的半宽
     *
     * 把轴长换算为高斯标准差，再求零均值高斯降到峰值 overlap 倍处的偏移
     * x = σ·√(-2·ln(overlap))。相邻波束按 2x 间距摆放时，中点处各自的响应
     * 恰为峰值的 overlap 倍。
     *
     * @param overlap 重叠度，开区间 (0, 1)
     * @return 半宽（度）
     * @throws InvalidOverlapException overlap 不在 (0, 1) 内
     */
    public BeamWidth widthAtOverlap(double overlap) {
        checkOverlap(overlap);
        double sigmaH = axisH * (2.0 / FWHM_PER_SIGMA);
        double sigmaV = axisV * (2.0 / FWHM_PER_SIGMA);
        return new BeamWidth(normInverse(overlap, sigmaH), normInverse(overlap, sigmaV));
    }

    static void checkOverlap(double overlap) {
        if (!(overlap > 0.0 && overlap < 1.0)) {
            throw new InvalidOverlapException(overlap);
        }
    }

    private static double normInverse(double fraction, double sigma) {
        return sigma * FastMath.sqrt(-2.0 * FastMath.log(fraction));
    }

    public double getAxisH() {
        return axisH;
    }

    public double getAxisV() {
        return axisV;
    }

    public double getAngle() {
        return angle;
    }

    /**
     * @return 点扩散函数；由 {@link #ofAxes} 构造时为 null
     */
    public PointSpreadFunction getPsf() {
        return psf;
    }

    public AntennaGeometry getAntennas() {
        return antennas;
    }

    public double[] getBoreSight() {
        return boreSight.clone();
    }

    public AntennaPosition getReferenceAntenna() {
        return referenceAntenna;
    }

    /**
     * @return [方位角, 仰角]（度）；由 {@link #ofAxes} 构造时为 null
     */
    public double[] getHorizon() {
        return horizon == null ? null : horizon.clone();
    }

    @Override
    public String toString() {
        return "BeamShape{" +
                "axisH=" + axisH +
                ", axisV=" + axisV +
                ", angle=" + angle +
                ", antennas=" + antennas.size() +
                '}';
    }
}
