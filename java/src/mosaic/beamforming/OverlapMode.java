package mosaic.beamforming;

import java.util.Locale;

/**
 * 重叠计算模式
 */
public enum OverlapMode {

    /** 每个网格点被多少个波束覆盖（整数计数） */
    COUNTER("counter"),

    /** 每个网格点上各波束高斯响应之和 */
    HEATER("heater");

    private final String label;

    OverlapMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 按名称解析模式，大小写不敏感
     *
     * @throws UnsupportedModeException 未知模式
     */
    public static OverlapMode fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toLowerCase(Locale.ROOT);
            for (OverlapMode mode : values()) {
                if (mode.label.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new UnsupportedModeException("unknown overlap mode: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
