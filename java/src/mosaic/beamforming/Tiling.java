package mosaic.beamforming;

import mosaic.beamforming.calculator.OverlapCalculator;
import mosaic.beamforming.model.BeamWidth;
import mosaic.helper.SkyGeometry;

import org.hipparchus.util.FastMath;

/**
 * 排布结果
 *
 * 波束中心为相对指向的切平面偏移 (x, y)（度），x 朝赤经增加方向，y 朝北。
 * 坐标顺序即波束编号，下游（延迟分配、绘图）必须保持。
 * 波束形状为共享只读引用。
 */
public final class Tiling {

    private final double[][] coordinates;
    private final BeamShape beamShape;
    private final double tilingRadius;
    private final double overlap;

    /**
     * 创建排布结果
     *
     * @param coordinates 波束中心 [x, y]（度）
     * @param beamShape 波束形状
     * @param tilingRadius 排布外接半径（度）
     * @param overlap 重叠度，开区间 (0, 1)
     */
    public Tiling(double[][] coordinates, BeamShape beamShape, double tilingRadius, double overlap) {
        BeamShape.checkOverlap(overlap);
        if (!(tilingRadius >= 0)) {
            throw new IllegalArgumentException("tiling radius should be non-negative, got " + tilingRadius);
        }
        this.coordinates = new double[coordinates.length][];
        for (int i = 0; i < coordinates.length; i++) {
            if (coordinates[i].length != 2) {
                throw new IllegalArgumentException("tiling coordinate " + i + " should be [x, y]");
            }
            this.coordinates[i] = coordinates[i].clone();
        }
        this.beamShape = beamShape;
        this.tilingRadius = tilingRadius;
        this.overlap = overlap;
    }

    /**
     * 波束数，总是等于坐标个数
     */
    public int getBeamNum() {
        return coordinates.length;
    }

    public double[][] getCoordinates() {
        double[][] copy = new double[coordinates.length][];
        for (int i = 0; i < coordinates.length; i++) {
            copy[i] = coordinates[i].clone();
        }
        return copy;
    }

    public BeamShape getBeamShape() {
        return beamShape;
    }

    public double getTilingRadius() {
        return tilingRadius;
    }

    public double getOverlap() {
        return overlap;
    }

    /**
     * 排布所用的椭圆半宽
     */
    public BeamWidth getBeamWidth() {
        return beamShape.widthAtOverlap(overlap);
    }

    /**
     * 切平面坐标转赤道坐标
     *
     * @return 每行 [赤经, 赤纬]（度），赤经在 [0, 360) 内
     */
    public double[][] getEquatorialCoordinates() {
        double[] boreSight = beamShape.getBoreSight();
        double ra0 = FastMath.toRadians(boreSight[0]);
        double dec0 = FastMath.toRadians(boreSight[1]);
        double[][] equatorial = new double[coordinates.length][];
        for (int i = 0; i < coordinates.length; i++) {
            double[] radec = SkyGeometry.tangentPlaneToEquatorial(
                FastMath.toRadians(coordinates[i][0]),
                FastMath.toRadians(coordinates[i][1]),
                ra0, dec0
            );
            equatorial[i] = new double[]{FastMath.toDegrees(radec[0]), FastMath.toDegrees(radec[1])};
        }
        return equatorial;
    }

    /**
     * 天空图样（加热模式重叠）
     */
    public Overlap getSkyPattern() {
        return calculateOverlap(OverlapMode.HEATER, null);
    }

    public Overlap calculateOverlap(OverlapMode mode) {
        return calculateOverlap(mode, null);
    }

    /**
     * 计算排布的重叠
     *
     * @param mode 计算模式
     * @param newBeamShape 替代的波束形状；为 null 时使用本排布自己的形状
     */
    public Overlap calculateOverlap(OverlapMode mode, BeamShape newBeamShape) {
        return calculateOverlap(mode, newBeamShape, new OverlapCalculator());
    }

    public Overlap calculateOverlap(OverlapMode mode, BeamShape newBeamShape, OverlapCalculator calculator) {
        BeamShape shape = newBeamShape != null ? newBeamShape : beamShape;
        double[][] metrics = calculator.calculateBeamOverlaps(
            coordinates, tilingRadius,
            shape.getAxisH(), shape.getAxisV(), shape.getAngle(),
            mode
        );
        return new Overlap(metrics, mode);
    }

    @Override
    public String toString() {
        return "Tiling{" +
                "beamNum=" + getBeamNum() +
                ", tilingRadius=" + tilingRadius +
                ", overlap=" + overlap +
                '}';
    }
}
