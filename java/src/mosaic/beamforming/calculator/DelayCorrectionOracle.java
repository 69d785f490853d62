package mosaic.beamforming.calculator;

import mosaic.beamforming.model.AntennaGeometry;
import mosaic.beamforming.model.AntennaPosition;
import mosaic.beamforming.model.DelayCorrections;
import mosaic.beamforming.model.EquatorialTarget;

/**
 * 延迟校正预言机
 *
 * 由 (天线集合, 参考天线, 参考频率) 构造，对每个目标给出时间窗内的延迟与相位多项式
 */
public interface DelayCorrectionOracle {

    /**
     * @param target 目标
     * @param startEpoch 时间窗起点（纪元秒）
     * @param endEpoch 时间窗终点（纪元秒）
     */
    DelayCorrections corrections(EquatorialTarget target, double startEpoch, double endEpoch);

    /**
     * 预言机工厂
     */
    interface Factory {
        DelayCorrectionOracle create(AntennaGeometry antennas, AntennaPosition reference, double frequency);
    }
}
