package mosaic.beamforming.calculator;

import mosaic.beamforming.InvalidInputTypeException;
import mosaic.beamforming.model.EquatorialTarget;

import org.hipparchus.util.FastMath;
import org.orekit.time.AbsoluteDate;
import org.orekit.time.DateTimeComponents;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScalesFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Locale;

/**
 * 星历/坐标适配器
 *
 * 把 [赤经, 赤纬] 字面量转换为目标句柄，把各种时间表示统一为Unix纪元秒。
 * 两种转换都是纯函数，没有副作用。
 */
public class EphemerisAdapter {

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final int UNIX_EPOCH_MJD = 40587;

    private final TimeScale utc;

    public EphemerisAdapter() {
        this(null);
    }

    /**
     * @param utc 解析 {@link AbsoluteDate} 时使用的UTC时间尺度；为null时按需从Orekit数据加载
     */
    public EphemerisAdapter(TimeScale utc) {
        this.utc = utc;
    }

    /**
     * 由赤经赤纬（度）创建目标
     */
    public EquatorialTarget toTarget(double rightAscension, double declination) {
        if (!Double.isFinite(rightAscension) || !Double.isFinite(declination)
                || declination < -90.0 || declination > 90.0) {
            throw new InvalidInputTypeException("target",
                    "not a valid [ra, dec] pair: [" + rightAscension + ", " + declination + "]");
        }
        String name = String.format(Locale.ROOT, "%.6f %+.6f", rightAscension, declination);
        return new EquatorialTarget(name,
                FastMath.toRadians(rightAscension),
                FastMath.toRadians(declination));
    }

    /**
     * 把时间值统一为Unix纪元秒
     *
     * @param time Number（已是纪元秒）、Instant、Date、ZonedDateTime、OffsetDateTime、
     *             LocalDateTime（按UTC解释）或Orekit AbsoluteDate
     * @return 纪元秒
     * @throws InvalidInputTypeException 无法识别的时间类型
     */
    public double toEpochSeconds(Object time) {
        if (time instanceof Number) {
            double seconds = ((Number) time).doubleValue();
            if (!Double.isFinite(seconds)) {
                throw new InvalidInputTypeException("time", "epoch seconds must be finite, got " + seconds);
            }
            return seconds;
        }
        if (time instanceof Instant) {
            return toEpochSeconds((Instant) time);
        }
        if (time instanceof ZonedDateTime) {
            return toEpochSeconds(((ZonedDateTime) time).toInstant());
        }
        if (time instanceof OffsetDateTime) {
            return toEpochSeconds(((OffsetDateTime) time).toInstant());
        }
        if (time instanceof LocalDateTime) {
            return toEpochSeconds(((LocalDateTime) time).toInstant(ZoneOffset.UTC));
        }
        if (time instanceof Date) {
            return ((Date) time).getTime() / 1000.0;
        }
        if (time instanceof AbsoluteDate) {
            return toEpochSeconds((AbsoluteDate) time);
        }
        throw new InvalidInputTypeException("time", time);
    }

    private double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1.0e9;
    }

    private double toEpochSeconds(AbsoluteDate date) {
        DateTimeComponents components = date.getComponents(utc != null ? utc : TimeScalesFactory.getUTC());
        // 纪元秒不计闰秒，按UTC日历日计算
        return (components.getDate().getMJD() - UNIX_EPOCH_MJD) * SECONDS_PER_DAY
                + components.getTime().getSecondsInUTCDay();
    }
}
