package mosaic.beamforming.model;

/**
 * 主瓣半功率椭圆：半长轴、半短轴（度）与方向角（度，自 +x 逆时针）
 */
public final class BeamAxis {
    private final double axisH;
    private final double axisV;
    private final double angle;

    public BeamAxis(double axisH, double axisV, double angle) {
        this.axisH = axisH;
        this.axisV = axisV;
        this.angle = angle;
    }

    public double getAxisH() { return axisH; }
    public double getAxisV() { return axisV; }
    public double getAngle() { return angle; }

    @Override
    public String toString() {
        return "BeamAxis{axisH=" + axisH + ", axisV=" + axisV + ", angle=" + angle + '}';
    }
}
