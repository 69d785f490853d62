package mosaic.beamforming.calculator;

import mosaic.beamforming.model.PackingResult;

import org.hipparchus.util.FastMath;
import org.hipparchus.util.MathUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * 椭圆六角排布
 *
 * 在以半宽归一化的坐标系 (x/widthH, y/widthV) 中，波束是半径为1的圆，
 * 按间距2的六角格排列，相邻波束在中点处的响应正好等于给定重叠度。
 * 格点再按椭圆方向角旋转到切平面。
 *
 * 输出坐标按到原点的距离、再按极角排序，这个顺序即波束编号。
 */
public class EllipsePacker implements PackingEngine {

    private static final Logger logger = Logger.getLogger(EllipsePacker.class.getName());

    private static final double SQRT3 = FastMath.sqrt(3.0);
    // 排序时距离的量化精度（度）
    private static final double DISTANCE_QUANTUM = 1.0e-9;

    @Override
    public PackingResult compact(int beamNum, double widthH, double widthV, double angle, int precision) {
        if (beamNum < 1) {
            throw new IllegalArgumentException("beam number should be at least 1, got " + beamNum);
        }
        if (precision < 1) {
            throw new IllegalArgumentException("precision should be at least 1, got " + precision);
        }
        checkWidths(widthH, widthV);

        int range = latticeRange(FastMath.sqrt(1.1 * beamNum) + 2.0, widthH, widthV);

        List<double[]> best = null;
        double bestRadius = Double.MAX_VALUE;
        // 在单位格内尝试 precision × precision 个偏移
        for (int a = 0; a < precision; a++) {
            for (int b = 0; b < precision; b++) {
                List<double[]> points = lattice(range, (double) a / precision, (double) b / precision,
                                                widthH, widthV, angle);
                points.sort(CANONICAL_ORDER);
                List<double[]> chosen = points.subList(0, beamNum);
                double radius = distance(chosen.get(beamNum - 1)) + widthH;
                if (radius < bestRadius) {
                    bestRadius = radius;
                    best = new ArrayList<>(chosen);
                }
            }
        }

        logger.fine(String.format("compact packing of %d beams, radius %.6f deg", beamNum, bestRadius));
        return new PackingResult(best.toArray(new double[0][]), bestRadius);
    }

    @Override
    public double[][] grid(double radius, double widthH, double widthV, double angle) {
        if (!(radius >= 0)) {
            throw new IllegalArgumentException("radius should be non-negative, got " + radius);
        }
        checkWidths(widthH, widthV);

        int range = latticeRange(radius / FastMath.min(widthH, widthV), 1.0, 1.0);
        List<double[]> points = lattice(range, 0.0, 0.0, widthH, widthV, angle);
        List<double[]> inside = new ArrayList<>();
        for (double[] point : points) {
            if (distance(point) <= radius + DISTANCE_QUANTUM) {
                inside.add(point);
            }
        }
        inside.sort(CANONICAL_ORDER);

        logger.fine(String.format("grid packing inside %.6f deg: %d beams", radius, inside.size()));
        return inside.toArray(new double[0][]);
    }

    /**
     * 生成六角格点
     *
     * @param range i、j 的取值半径
     * @param offsetA 沿第一基矢的偏移（格单位）
     * @param offsetB 沿第二基矢的偏移（格单位）
     */
    private List<double[]> lattice(int range, double offsetA, double offsetB,
                                   double widthH, double widthV, double angle) {
        double cos = FastMath.cos(FastMath.toRadians(angle));
        double sin = FastMath.sin(FastMath.toRadians(angle));
        List<double[]> points = new ArrayList<>();
        for (int j = -range; j <= range; j++) {
            for (int i = -range - 1; i <= range + 1; i++) {
                double a = i + offsetA;
                double b = j + offsetB;
                // 归一化坐标，再按半宽缩放
                double x = (2.0 * a + b) * widthH;
                double y = SQRT3 * b * widthV;
                points.add(new double[]{x * cos - y * sin, x * sin + y * cos});
            }
        }
        return points;
    }

    /**
     * 覆盖归一化半径 rho 所需的格点范围；椭圆越扁，需要的范围越大
     */
    private static int latticeRange(double rho, double widthH, double widthV) {
        return (int) FastMath.ceil(rho * FastMath.max(widthH, widthV) / FastMath.min(widthH, widthV)) + 1;
    }

    private static void checkWidths(double widthH, double widthV) {
        if (!(widthH > 0) || !(widthV > 0)) {
            throw new IllegalArgumentException(
                "beam widths should be positive, got " + widthH + ", " + widthV);
        }
    }

    private static double distance(double[] point) {
        return FastMath.hypot(point[0], point[1]);
    }

    private static final Comparator<double[]> CANONICAL_ORDER =
        Comparator.<double[]>comparingLong(p -> FastMath.round(distance(p) / DISTANCE_QUANTUM))
                  .thenComparingDouble(p -> MathUtils.normalizeAngle(FastMath.atan2(p[1], p[0]), FastMath.PI));
}
