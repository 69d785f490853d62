package mosaic.helper;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

/**
 * 天球几何工具
 *
 * 恒星时、时角、基线投影和切平面投影。所有角度均为弧度。
 */
public final class SkyGeometry {

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double J2000_JD = 2451545.0;
    private static final double DAYS_PER_CENTURY = 36525.0;

    private SkyGeometry() {
    }

    /**
     * 格林尼治平恒星时（IAU 1982，UT1按UTC近似）
     *
     * @param epochSeconds Unix纪元秒
     * @return 弧度，[0, 2π)
     */
    public static double greenwichMeanSiderealTime(double epochSeconds) {
        double d = epochSeconds / SECONDS_PER_DAY + UNIX_EPOCH_JD - J2000_JD;
        double t = d / DAYS_PER_CENTURY;
        double degrees = 280.46061837
                + 360.98564736629 * d
                + 0.000387933 * t * t
                - t * t * t / 38710000.0;
        return MathUtils.normalizeAngle(FastMath.toRadians(degrees), FastMath.PI);
    }

    /**
     * 时角 H = LST - RA
     *
     * @param epochSeconds Unix纪元秒
     * @param longitude 观测点东经（弧度）
     * @param rightAscension 赤经（弧度）
     */
    public static double hourAngle(double epochSeconds, double longitude, double rightAscension) {
        double lst = greenwichMeanSiderealTime(epochSeconds) + longitude;
        return MathUtils.normalizeAngle(lst - rightAscension, 0.0);
    }

    /**
     * 赤道坐标转地平坐标
     *
     * @return [方位角（北起顺时针，[0, 2π)）, 仰角]
     */
    public static double[] toHorizontal(double hourAngle, double declination, double latitude) {
        double sinEl = FastMath.sin(latitude) * FastMath.sin(declination)
                + FastMath.cos(latitude) * FastMath.cos(declination) * FastMath.cos(hourAngle);
        double elevation = FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0, sinEl)));
        double azimuth = FastMath.atan2(
                -FastMath.cos(declination) * FastMath.sin(hourAngle),
                FastMath.sin(declination) * FastMath.cos(latitude)
                        - FastMath.cos(declination) * FastMath.cos(hourAngle) * FastMath.sin(latitude));
        return new double[]{MathUtils.normalizeAngle(azimuth, FastMath.PI), elevation};
    }

    /**
     * 站心ENU偏移转本地赤道坐标 (X, Y, Z)
     *
     * X 指向子午面与赤道交点，Y 指向东，Z 指向北天极
     */
    public static double[] enuToEquatorial(double[] enu, double latitude) {
        double sinLat = FastMath.sin(latitude);
        double cosLat = FastMath.cos(latitude);
        return new double[]{
            -sinLat * enu[1] + cosLat * enu[2],
            enu[0],
            cosLat * enu[1] + sinLat * enu[2]
        };
    }

    /**
     * 本地赤道坐标投影到 (u, v, w)，w 沿目标方向
     */
    public static double[] toUvw(double[] xyz, double hourAngle, double declination) {
        double sinH = FastMath.sin(hourAngle);
        double cosH = FastMath.cos(hourAngle);
        double sinD = FastMath.sin(declination);
        double cosD = FastMath.cos(declination);
        return new double[]{
            sinH * xyz[0] + cosH * xyz[1],
            -sinD * cosH * xyz[0] + sinD * sinH * xyz[1] + cosD * xyz[2],
            cosD * cosH * xyz[0] - cosD * sinH * xyz[1] + sinD * xyz[2]
        };
    }

    /**
     * 切平面偏移反投影（gnomonic）到赤道坐标
     *
     * @param xi 东向偏移（弧度）
     * @param eta 北向偏移（弧度）
     * @param rightAscension0 切点赤经
     * @param declination0 切点赤纬
     * @return [赤经（[0, 2π)）, 赤纬]
     */
    public static double[] tangentPlaneToEquatorial(double xi, double eta,
                                                    double rightAscension0, double declination0) {
        double rho = FastMath.hypot(xi, eta);
        if (rho == 0.0) {
            return new double[]{MathUtils.normalizeAngle(rightAscension0, FastMath.PI), declination0};
        }
        double c = FastMath.atan(rho);
        double sinC = FastMath.sin(c);
        double cosC = FastMath.cos(c);
        double sinD0 = FastMath.sin(declination0);
        double cosD0 = FastMath.cos(declination0);

        double declination = FastMath.asin(cosC * sinD0 + eta * sinC * cosD0 / rho);
        double rightAscension = rightAscension0 + FastMath.atan2(
                xi * sinC, rho * cosD0 * cosC - eta * sinD0 * sinC);
        return new double[]{MathUtils.normalizeAngle(rightAscension, FastMath.PI), declination};
    }
}
