package mosaic.beamforming.calculator;

import mosaic.beamforming.BeamShape;
import mosaic.beamforming.MosaicConfig;
import mosaic.beamforming.OverlapMode;

import org.hipparchus.util.FastMath;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * 波束重叠计算器
 *
 * 在 [-R, R]² 的规则网格上对每个波束的椭圆高斯响应求和或计数。
 * 网格第0行位于 +y（北）一侧，第0列位于 -x 一侧。
 *
 * 各网格行相互独立，并行时每行只由一个任务写入，结果与串行完全一致。
 */
public class OverlapCalculator {

    private static final Logger logger = Logger.getLogger(OverlapCalculator.class.getName());

    private final int gridSize;
    private final double coverageThreshold;
    private final boolean useParallel;

    public OverlapCalculator() {
        this(new MosaicConfig());
    }

    public OverlapCalculator(MosaicConfig config) {
        if (config.getOverlapGridSize() < 2) {
            throw new IllegalArgumentException(
                "overlap grid size should be at least 2, got " + config.getOverlapGridSize());
        }
        this.gridSize = config.getOverlapGridSize();
        this.coverageThreshold = config.getCoverageThreshold();
        this.useParallel = config.isUseParallel();
    }

    /**
     * 计算波束重叠网格
     *
     * @param coordinates 波束中心（度）
     * @param radius 排布半径（度），为0时用半长轴作为网格半宽
     * @param axisH 半长轴（度）
     * @param axisV 半短轴（度）
     * @param angle 长轴方向（度）
     * @param mode 计算模式
     * @return gridSize × gridSize 网格
     */
    public double[][] calculateBeamOverlaps(double[][] coordinates,
                                            double radius,
                                            double axisH,
                                            double axisV,
                                            double angle,
                                            OverlapMode mode) {
        if (!(axisH > 0) || !(axisV > 0)) {
            throw new IllegalArgumentException(
                "beam axes should be positive for overlap calculation, got " + axisH + ", " + axisV);
        }
        double extent = radius > 0 ? radius : axisH;
        BeamFootprint footprint = new BeamFootprint(coordinates, axisH, axisV, angle);
        double[][] metrics = new double[gridSize][];

        long startNs = System.nanoTime();
        if (useParallel) {
            fillParallel(metrics, footprint, extent, mode);
        } else {
            for (int row = 0; row < gridSize; row++) {
                metrics[row] = computeRow(row, footprint, extent, mode);
            }
        }
        logger.fine(String.format("%s overlap of %d beams on %dx%d grid in %d ms",
                mode, coordinates.length, gridSize, gridSize,
                (System.nanoTime() - startNs) / 1_000_000));
        return metrics;
    }

    private double[] computeRow(int row, BeamFootprint footprint, double extent, OverlapMode mode) {
        double step = 2.0 * extent / (gridSize - 1);
        double y = extent - row * step;
        double[] values = new double[gridSize];
        for (int col = 0; col < gridSize; col++) {
            double x = -extent + col * step;
            values[col] = mode == OverlapMode.COUNTER
                    ? footprint.count(x, y, coverageThreshold)
                    : footprint.sum(x, y);
        }
        return values;
    }

    /**
     * 并行计算（每行一个任务）
     */
    private void fillParallel(double[][] metrics, BeamFootprint footprint, double extent, OverlapMode mode) {
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(gridSize, Runtime.getRuntime().availableProcessors())
        );

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int row = 0; row < gridSize; row++) {
                final int r = row;
                futures.add(executor.submit(() -> {
                    metrics[r] = computeRow(r, footprint, extent, mode);
                }));
            }

            // 等待所有行完成
            for (Future<?> f : futures) {
                try {
                    f.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Parallel overlap calculation interrupted", e);
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof RuntimeException) {
                        throw (RuntimeException) e.getCause();
                    }
                    throw new IllegalStateException("Parallel overlap calculation failed", e.getCause());
                }
            }
        } finally {
            executor.shutdown();
        }
    }

    /**
     * 一组同形状、同方向的椭圆高斯波束
     */
    private static final class BeamFootprint {
        private final double[][] centers;
        private final double cos;
        private final double sin;
        private final double sigmaH;
        private final double sigmaV;

        BeamFootprint(double[][] centers, double axisH, double axisV, double angle) {
            this.centers = centers;
            this.cos = FastMath.cos(FastMath.toRadians(angle));
            this.sin = FastMath.sin(FastMath.toRadians(angle));
            this.sigmaH = axisH * 2.0 / BeamShape.FWHM_PER_SIGMA;
            this.sigmaV = axisV * 2.0 / BeamShape.FWHM_PER_SIGMA;
        }

        double response(double[] center, double x, double y) {
            double dx = x - center[0];
            double dy = y - center[1];
            double along = (dx * cos + dy * sin) / sigmaH;
            double across = (-dx * sin + dy * cos) / sigmaV;
            return FastMath.exp(-0.5 * (along * along + across * across));
        }

        double sum(double x, double y) {
            double total = 0.0;
            for (double[] center : centers) {
                total += response(center, x, y);
            }
            return total;
        }

        int count(double x, double y, double threshold) {
            int covered = 0;
            for (double[] center : centers) {
                if (response(center, x, y) >= threshold) {
                    covered++;
                }
            }
            return covered;
        }
    }
}
