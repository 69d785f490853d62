package mosaic.beamforming.model;

import org.hipparchus.util.FastMath;
import org.orekit.bodies.GeodeticPoint;

import java.io.Serializable;
import java.util.Objects;

/**
 * 天线位置
 *
 * 表示阵列中单根天线（或阵列参考点）的地理坐标，构造后不可变
 */
public class AntennaPosition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final double latitude;   // 度
    private final double longitude;  // 度
    private final double altitude;   // 米

    /**
     * 创建天线位置
     *
     * @param id 天线标识，用于延迟结果与天线的对应
     * @param latitude 纬度（度）
     * @param longitude 经度（度）
     * @param altitude 海拔（米）
     */
    public AntennaPosition(String id, double latitude, double longitude, double altitude) {
        this.id = Objects.requireNonNull(id, "id");
        this.latitude = latitude;
        this.longitude = longitude;
        this.altitude = altitude;
    }

    /**
     * 从Orekit地理点创建（地理点使用弧度）
     */
    public static AntennaPosition fromGeodeticPoint(String id, GeodeticPoint point) {
        return new AntennaPosition(id,
                FastMath.toDegrees(point.getLatitude()),
                FastMath.toDegrees(point.getLongitude()),
                point.getAltitude());
    }

    public String getId() {
        return id;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getAltitude() {
        return altitude;
    }

    /**
     * 转换为Orekit地理点
     */
    public GeodeticPoint toGeodeticPoint() {
        return new GeodeticPoint(
            FastMath.toRadians(latitude),
            FastMath.toRadians(longitude),
            altitude
        );
    }

    /**
     * @return [纬度, 经度, 海拔]
     */
    public double[] toArray() {
        return new double[]{latitude, longitude, altitude};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AntennaPosition)) {
            return false;
        }
        AntennaPosition that = (AntennaPosition) o;
        return Double.compare(that.latitude, latitude) == 0
                && Double.compare(that.longitude, longitude) == 0
                && Double.compare(that.altitude, altitude) == 0
                && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, latitude, longitude, altitude);
    }

    @Override
    public String toString() {
        return "AntennaPosition{" +
                "id='" + id + '\'' +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", altitude=" + altitude +
                '}';
    }
}
