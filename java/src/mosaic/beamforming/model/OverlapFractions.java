package mosaic.beamforming.model;

/**
 * 计数模式下各覆盖情形所占的网格比例
 */
public final class OverlapFractions {
    private final double overlapped;
    private final double nonOverlapped;
    private final double empty;

    public OverlapFractions(double overlapped, double nonOverlapped, double empty) {
        this.overlapped = overlapped;
        this.nonOverlapped = nonOverlapped;
        this.empty = empty;
    }

    /** 被两个及以上波束覆盖 */
    public double getOverlapped() { return overlapped; }

    /** 仅被一个波束覆盖 */
    public double getNonOverlapped() { return nonOverlapped; }

    /** 未被覆盖 */
    public double getEmpty() { return empty; }

    @Override
    public String toString() {
        return String.format(
            "OverlapFractions{overlapped=%.4f, nonOverlapped=%.4f, empty=%.4f}",
            overlapped, nonOverlapped, empty
        );
    }
}
