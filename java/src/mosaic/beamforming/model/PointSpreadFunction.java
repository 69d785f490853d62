package mosaic.beamforming.model;

/**
 * 点扩散函数栅格
 *
 * image[行][列]，第0行位于北侧，第0列位于东侧偏移最小处；峰值归一化为1。
 * 由观测引擎拥有，此处只读。
 */
public final class PointSpreadFunction {
    private final double[][] image;
    private final double[] boreSight;  // [赤经, 赤纬]，度
    private final double width;        // 栅格覆盖的角宽度，度

    public PointSpreadFunction(double[][] image, double[] boreSight, double width) {
        this.image = PackingResult.copy(image);
        this.boreSight = boreSight.clone();
        this.width = width;
    }

    public double[][] getImage() { return PackingResult.copy(image); }
    public double[] getBoreSight() { return boreSight.clone(); }
    public double getWidth() { return width; }

    /** 每像素对应的角度（度） */
    public double getStep() {
        return image.length == 0 ? 0.0 : width / image.length;
    }
}
