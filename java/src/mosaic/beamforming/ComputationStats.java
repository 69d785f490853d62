package mosaic.beamforming;

import java.io.Serializable;

/**
 * 计算统计信息
 *
 * 记录一次排布流水线的性能指标
 */
public class ComputationStats implements Serializable {

    private static final long serialVersionUID = 1L;

    private long computationTimeMs;
    private int nAntennas;
    private int nBeams;
    private int gridSize;
    private long memoryUsageMb;

    public ComputationStats(long computationTimeMs, int nAntennas,
                           int nBeams, int gridSize, long memoryUsageMb) {
        this.computationTimeMs = computationTimeMs;
        this.nAntennas = nAntennas;
        this.nBeams = nBeams;
        this.gridSize = gridSize;
        this.memoryUsageMb = memoryUsageMb;
    }

    // Getters
    public long getComputationTimeMs() {
        return computationTimeMs;
    }

    public int getNAntennas() {
        return nAntennas;
    }

    public int getNBeams() {
        return nBeams;
    }

    public int getGridSize() {
        return gridSize;
    }

    public long getMemoryUsageMb() {
        return memoryUsageMb;
    }

    @Override
    public String toString() {
        return String.format(
            "ComputationStats{time=%dms, antennas=%d, beams=%d, grid=%d, mem=%dMB}",
            computationTimeMs, nAntennas, nBeams, gridSize, memoryUsageMb
        );
    }
}
