package mosaic.beamforming.model;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.io.Serializable;
import java.util.Locale;

/**
 * 赤道坐标目标
 *
 * 星历适配器产生的规范化目标句柄，内部以弧度保存赤经赤纬
 */
public final class EquatorialTarget implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final double rightAscension;  // 弧度，[0, 2π)
    private final double declination;     // 弧度

    /**
     * 创建目标
     *
     * @param name 目标名称
     * @param rightAscension 赤经（弧度）
     * @param declination 赤纬（弧度）
     */
    public EquatorialTarget(String name, double rightAscension, double declination) {
        if (declination < -MathUtils.SEMI_PI || declination > MathUtils.SEMI_PI) {
            throw new IllegalArgumentException("declination out of range: " + declination);
        }
        this.name = name;
        this.rightAscension = MathUtils.normalizeAngle(rightAscension, FastMath.PI);
        this.declination = declination;
    }

    public String getName() {
        return name;
    }

    public double getRightAscension() {
        return rightAscension;
    }

    public double getDeclination() {
        return declination;
    }

    public double getRightAscensionDegrees() {
        return FastMath.toDegrees(rightAscension);
    }

    public double getDeclinationDegrees() {
        return FastMath.toDegrees(declination);
    }

    /**
     * 天球单位方向矢量（赤道惯性系）
     */
    public Vector3D getDirection() {
        return new Vector3D(rightAscension, declination);
    }

    /**
     * katpoint 风格描述，例如 "radec, 12:30:00.00, -30:00:00.0"
     */
    public String getDescription() {
        return String.join(", ", "radec",
                formatSexagesimal(getRightAscensionDegrees() / 15.0, 2),
                formatSexagesimal(getDeclinationDegrees(), 1));
    }

    private static String formatSexagesimal(double value, int decimals) {
        String sign = value < 0 ? "-" : "";
        double abs = FastMath.abs(value);
        double scale = FastMath.pow(10, decimals);
        // 先按最小单位取整，避免出现 60 秒
        long ticks = FastMath.round(abs * 3600.0 * scale);
        long whole = ticks / (3600L * (long) scale);
        long minutes = (ticks / (60L * (long) scale)) % 60;
        double seconds = (ticks % (60L * (long) scale)) / scale;
        return String.format(Locale.ROOT, "%s%d:%02d:%0" + (3 + decimals) + "." + decimals + "f",
                sign, whole, minutes, seconds);
    }

    @Override
    public String toString() {
        return "EquatorialTarget{" +
                "name='" + name + '\'' +
                ", ra=" + getRightAscensionDegrees() +
                ", dec=" + getDeclinationDegrees() +
                '}';
    }
}
