package mosaic.beamforming;

import mosaic.beamforming.model.OverlapFractions;

/**
 * 重叠计算结果
 *
 * 排布区域内采样网格上的覆盖度量及所用的计算模式。无回指引用。
 */
public final class Overlap {

    private final double[][] metrics;
    private final OverlapMode mode;

    public Overlap(double[][] metrics, OverlapMode mode) {
        this.metrics = new double[metrics.length][];
        for (int i = 0; i < metrics.length; i++) {
            this.metrics[i] = metrics[i].clone();
        }
        this.mode = mode;
    }

    public double[][] getMetrics() {
        double[][] copy = new double[metrics.length][];
        for (int i = 0; i < metrics.length; i++) {
            copy[i] = metrics[i].clone();
        }
        return copy;
    }

    public OverlapMode getMode() {
        return mode;
    }

    /**
     * 统计区域内各覆盖情形的占比，仅支持计数模式
     *
     * @return 重叠（计数 > 1）、单波束（计数 == 1）、空白（计数 == 0）的比例
     * @throws UnsupportedModeException 非计数模式
     */
    public OverlapFractions calculateFractions() {
        if (mode != OverlapMode.COUNTER) {
            throw new UnsupportedModeException(
                "the fraction calculation is only supported in counter mode, got " + mode);
        }
        long overlapGrid = 0;
        long nonOverlapGrid = 0;
        long emptyGrid = 0;
        for (double[] row : metrics) {
            for (double count : row) {
                if (count > 1) {
                    overlapGrid++;
                } else if (count == 1) {
                    nonOverlapGrid++;
                } else if (count == 0) {
                    emptyGrid++;
                }
            }
        }
        double pointNum = overlapGrid + nonOverlapGrid + emptyGrid;
        if (pointNum == 0) {
            throw new IllegalStateException("overlap grid has no samples");
        }
        return new OverlapFractions(
            overlapGrid / pointNum,
            nonOverlapGrid / pointNum,
            emptyGrid / pointNum
        );
    }
}
