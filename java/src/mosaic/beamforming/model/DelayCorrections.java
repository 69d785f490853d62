package mosaic.beamforming.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 延迟校正预言机对单个目标的响应
 *
 * 键为输入通道（天线标识 + 极化后缀），值为 [时间段][{值, 变化率}]
 */
public final class DelayCorrections {
    private final Map<String, double[][]> delays;
    private final Map<String, double[][]> phases;

    public DelayCorrections(Map<String, double[][]> delays, Map<String, double[][]> phases) {
        this.delays = Collections.unmodifiableMap(new LinkedHashMap<>(delays));
        this.phases = Collections.unmodifiableMap(new LinkedHashMap<>(phases));
    }

    public Map<String, double[][]> getDelays() { return delays; }
    public Map<String, double[][]> getPhases() { return phases; }
}
