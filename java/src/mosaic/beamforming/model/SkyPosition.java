package mosaic.beamforming.model;

import mosaic.beamforming.InvalidInputTypeException;
import mosaic.beamforming.calculator.EphemerisAdapter;

import java.util.List;

/**
 * 天空位置输入
 *
 * 两种形式之一：[赤经, 赤纬] 字面量（度），或星历适配器产生的目标句柄。
 * 在边界处解析一次，内部逻辑只处理 {@link EquatorialTarget}。
 */
public abstract class SkyPosition {

    private SkyPosition() {
    }

    /**
     * 解析任意输入为天空位置
     *
     * @param input double[]、数字列表、EquatorialTarget 或 SkyPosition
     * @throws InvalidInputTypeException 无法识别的输入
     */
    public static SkyPosition of(Object input) {
        if (input instanceof SkyPosition) {
            return (SkyPosition) input;
        }
        if (input instanceof EquatorialTarget) {
            return new Handle((EquatorialTarget) input);
        }
        if (input instanceof double[]) {
            double[] values = (double[]) input;
            if (values.length != 2) {
                throw new InvalidInputTypeException("source",
                        "expected [ra, dec], got " + values.length + " values");
            }
            return new Literal(values[0], values[1]);
        }
        if (input instanceof List) {
            List<?> values = (List<?>) input;
            if (values.size() != 2
                    || !(values.get(0) instanceof Number)
                    || !(values.get(1) instanceof Number)) {
                throw new InvalidInputTypeException("source", "expected [ra, dec] numbers, got " + values);
            }
            return new Literal(((Number) values.get(0)).doubleValue(),
                    ((Number) values.get(1)).doubleValue());
        }
        throw new InvalidInputTypeException("source", input);
    }

    public static SkyPosition ofDegrees(double rightAscension, double declination) {
        return new Literal(rightAscension, declination);
    }

    /**
     * 规范化为目标句柄
     */
    public abstract EquatorialTarget resolve(EphemerisAdapter ephemeris);

    /**
     * 字面量 [赤经, 赤纬]，单位度
     */
    public static final class Literal extends SkyPosition {

        private final double rightAscension;
        private final double declination;

        Literal(double rightAscension, double declination) {
            this.rightAscension = rightAscension;
            this.declination = declination;
        }

        public double getRightAscension() {
            return rightAscension;
        }

        public double getDeclination() {
            return declination;
        }

        @Override
        public EquatorialTarget resolve(EphemerisAdapter ephemeris) {
            return ephemeris.toTarget(rightAscension, declination);
        }
    }

    /**
     * 已解析的目标句柄
     */
    public static final class Handle extends SkyPosition {

        private final EquatorialTarget target;

        Handle(EquatorialTarget target) {
            this.target = target;
        }

        public EquatorialTarget getTarget() {
            return target;
        }

        @Override
        public EquatorialTarget resolve(EphemerisAdapter ephemeris) {
            return target;
        }
    }
}
