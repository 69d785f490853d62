package mosaic.beamforming.model;

/**
 * 给定重叠度下沿长轴、短轴方向的波束半宽（度）
 */
public final class BeamWidth {
    private final double widthH;
    private final double widthV;

    public BeamWidth(double widthH, double widthV) {
        this.widthH = widthH;
        this.widthV = widthV;
    }

    public double getWidthH() { return widthH; }
    public double getWidthV() { return widthV; }

    @Override
    public String toString() {
        return "BeamWidth{widthH=" + widthH + ", widthV=" + widthV + '}';
    }
}
