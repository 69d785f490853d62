package mosaic.beamforming.calculator;

import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.BeamAxis;
import mosaic.beamforming.model.PointSpreadFunction;

/**
 * 观测引擎
 *
 * 根据阵列几何和观测时间计算点扩散函数及其半功率轮廓。
 * 实现持有指向和时间状态，不保证线程安全：调用方须在
 * setBoreSight / setObserveTime / createContour 与结果读取之间独占引擎。
 */
public interface ObservationEngine {

    /**
     * @param rightAscension 赤经（度）
     * @param declination 赤纬（度）
     */
    void setBoreSight(double rightAscension, double declination);

    /**
     * @param epochSeconds Unix纪元秒
     */
    void setObserveTime(double epochSeconds);

    void createContour(AntennaGeometry antennas);

    BeamAxis getBeamAxis();

    /**
     * @return [方位角, 仰角]，弧度
     */
    double[] getHorizontal();

    PointSpreadFunction getPointSpreadFunction();
}
