package mosaic.beamforming;

import java.io.Serializable;

/**
 * 计算配置
 *
 * 控制点扩散函数、排布、重叠统计和延迟多项式的可调参数
 */
public class MosaicConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private int packingPrecision = 10;              // 紧凑排布搜索精度
    private int overlapGridSize = 200;              // 重叠网格每边采样数
    private double coverageThreshold = 0.5;         // 计数模式下视为覆盖的响应阈值（相对峰值）
    private boolean useParallel = false;            // 是否并行计算重叠网格
    private int psfImageSize = 100;                 // PSF栅格每边像素数
    private double psfFieldScale = 3.0;             // PSF栅格半宽（半长轴倍数）
    private int contourAngleSteps = 180;            // 半功率轮廓追踪方向数
    private double delayReferenceFrequency = 1.4e9; // 延迟计算参考频率（Hz）
    private String delayPolarization = "h";         // 输出延迟所取的极化
    private int delaySegmentIndex = 0;              // 输出延迟所取的多项式时间段
    private double defaultDelayDuration = 10.0;     // 默认多项式有效时长（秒）

    public MosaicConfig() {
    }

    // Getters and Setters
    public int getPackingPrecision() {
        return packingPrecision;
    }

    public void setPackingPrecision(int packingPrecision) {
        this.packingPrecision = packingPrecision;
    }

    public int getOverlapGridSize() {
        return overlapGridSize;
    }

    public void setOverlapGridSize(int overlapGridSize) {
        this.overlapGridSize = overlapGridSize;
    }

    public double getCoverageThreshold() {
        return coverageThreshold;
    }

    public void setCoverageThreshold(double coverageThreshold) {
        this.coverageThreshold = coverageThreshold;
    }

    public boolean isUseParallel() {
        return useParallel;
    }

    public void setUseParallel(boolean useParallel) {
        this.useParallel = useParallel;
    }

    public int getPsfImageSize() {
        return psfImageSize;
    }

    public void setPsfImageSize(int psfImageSize) {
        this.psfImageSize = psfImageSize;
    }

    public double getPsfFieldScale() {
        return psfFieldScale;
    }

    public void setPsfFieldScale(double psfFieldScale) {
        this.psfFieldScale = psfFieldScale;
    }

    public int getContourAngleSteps() {
        return contourAngleSteps;
    }

    public void setContourAngleSteps(int contourAngleSteps) {
        this.contourAngleSteps = contourAngleSteps;
    }

    public double getDelayReferenceFrequency() {
        return delayReferenceFrequency;
    }

    public void setDelayReferenceFrequency(double delayReferenceFrequency) {
        this.delayReferenceFrequency = delayReferenceFrequency;
    }

    public String getDelayPolarization() {
        return delayPolarization;
    }

    public void setDelayPolarization(String delayPolarization) {
        this.delayPolarization = delayPolarization;
    }

    public int getDelaySegmentIndex() {
        return delaySegmentIndex;
    }

    public void setDelaySegmentIndex(int delaySegmentIndex) {
        this.delaySegmentIndex = delaySegmentIndex;
    }

    public double getDefaultDelayDuration() {
        return defaultDelayDuration;
    }

    public void setDefaultDelayDuration(double defaultDelayDuration) {
        this.defaultDelayDuration = defaultDelayDuration;
    }

    @Override
    public String toString() {
        return "MosaicConfig{" +
                "packingPrecision=" + packingPrecision +
                ", overlapGridSize=" + overlapGridSize +
                ", coverageThreshold=" + coverageThreshold +
                ", useParallel=" + useParallel +
                ", psfImageSize=" + psfImageSize +
                ", psfFieldScale=" + psfFieldScale +
                ", contourAngleSteps=" + contourAngleSteps +
                ", delayReferenceFrequency=" + delayReferenceFrequency +
                ", delayPolarization='" + delayPolarization + '\'' +
                ", delaySegmentIndex=" + delaySegmentIndex +
                ", defaultDelayDuration=" + defaultDelayDuration +
                '}';
    }
}
