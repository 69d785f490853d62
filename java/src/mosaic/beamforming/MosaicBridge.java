package mosaic.beamforming;

import mosaic.beamforming.calculator.OverlapCalculator;
import mosaic.beamforming.model.OverlapFractions;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 脚本调用入口
 *
 * 提供可由脚本语言（如JPype）直接调用的静态方法，输入为松散类型，
 * 输出为只含基本类型、数组和Map的结果，供绘图等下游使用。
 */
public class MosaicBridge {

    private static final Logger logger = Logger.getLogger(MosaicBridge.class.getName());

    private MosaicBridge() {
    }

    /**
     * 计算波束形状、紧凑排布及其重叠统计
     *
     * @param antennas 天线列表
     * @param frequency 观测频率（Hz）
     * @param boreSight 指向 [赤经, 赤纬]（度）
     * @param time 观测时间
     * @param beamNum 波束数
     * @param overlap 重叠度
     * @param config 计算配置
     * @return 结果Map；失败时含 error、errorMessage、errorType
     */
    public static Map<String, Object> computeTiling(
            List<?> antennas,
            double frequency,
            Object boreSight,
            Object time,
            int beamNum,
            double overlap,
            MosaicConfig config) {

        try {
            long startNs = System.nanoTime();

            // 1. 波束形状
            PsfSim psfSim = new PsfSim(antennas, config, frequency);
            BeamShape beamShape = psfSim.getBeamShape(boreSight, time);

            // 2. 排布
            Tiling tiling = new TilingGenerator(config).generateNBeamsTiling(beamShape, beamNum, overlap);

            // 3. 重叠统计
            Overlap counter = tiling.calculateOverlap(OverlapMode.COUNTER, null, new OverlapCalculator(config));
            OverlapFractions fractions = counter.calculateFractions();

            long elapsedNs = System.nanoTime() - startNs;
            ComputationStats stats = new ComputationStats(
                TimeUnit.NANOSECONDS.toMillis(elapsedNs),
                psfSim.getAntennas().size(),
                tiling.getBeamNum(),
                config.getOverlapGridSize(),
                Runtime.getRuntime().totalMemory() / (1024 * 1024)
            );

            return convertToMap(beamShape, tiling, fractions, stats);

        } catch (RuntimeException e) {
            return errorResult(e);
        }
    }

    /**
     * 计算延迟多项式
     *
     * @return 结果Map，delays 为 [目标][天线][{延迟, 变化率}]；失败时含错误信息
     */
    public static Map<String, Object> computeDelayPolynomials(
            List<?> antennas,
            List<?> targets,
            Object reference,
            Object epoch,
            double duration) {

        try {
            DelayPolynomial polynomial = new DelayPolynomial(antennas, targets, reference);
            double[][][] delays = polynomial.getDelayPolynomials(epoch, duration);

            Map<String, Object> map = new HashMap<>();
            map.put("delays", delays);
            map.put("nTargets", delays.length);
            map.put("nAntennas", polynomial.getAntennas().size());
            map.put("frequency", polynomial.getFrequency());
            return map;

        } catch (RuntimeException e) {
            return errorResult(e);
        }
    }

    /**
     * 转换为脚本友好的Map
     */
    private static Map<String, Object> convertToMap(BeamShape beamShape, Tiling tiling,
                                                    OverlapFractions fractions, ComputationStats stats) {
        Map<String, Object> map = new HashMap<>();

        // 波束形状
        Map<String, Object> shapeMap = new HashMap<>();
        shapeMap.put("axisH", beamShape.getAxisH());
        shapeMap.put("axisV", beamShape.getAxisV());
        shapeMap.put("angle", beamShape.getAngle());
        shapeMap.put("boreSight", beamShape.getBoreSight());
        shapeMap.put("horizon", beamShape.getHorizon());
        map.put("beamShape", shapeMap);

        // 排布
        Map<String, Object> tilingMap = new HashMap<>();
        tilingMap.put("coordinates", tiling.getCoordinates());
        tilingMap.put("equatorialCoordinates", tiling.getEquatorialCoordinates());
        tilingMap.put("tilingRadius", tiling.getTilingRadius());
        tilingMap.put("beamNum", tiling.getBeamNum());
        tilingMap.put("overlap", tiling.getOverlap());
        tilingMap.put("beamWidth", new double[]{
            tiling.getBeamWidth().getWidthH(), tiling.getBeamWidth().getWidthV()
        });
        map.put("tiling", tilingMap);

        // 重叠比例
        Map<String, Object> fractionMap = new HashMap<>();
        fractionMap.put("overlapped", fractions.getOverlapped());
        fractionMap.put("nonOverlapped", fractions.getNonOverlapped());
        fractionMap.put("empty", fractions.getEmpty());
        map.put("fractions", fractionMap);

        // 统计信息
        Map<String, Object> statsMap = new HashMap<>();
        statsMap.put("computationTimeMs", stats.getComputationTimeMs());
        statsMap.put("nAntennas", stats.getNAntennas());
        statsMap.put("nBeams", stats.getNBeams());
        statsMap.put("memoryUsageMb", stats.getMemoryUsageMb());
        map.put("stats", statsMap);

        return map;
    }

    private static Map<String, Object> errorResult(RuntimeException e) {
        logger.log(Level.WARNING, "bridge call failed: " + e.getMessage(), e);
        Map<String, Object> errorResult = new HashMap<>();
        errorResult.put("error", true);
        errorResult.put("errorMessage", e.getMessage());
        errorResult.put("errorType", e.getClass().getName());
        return errorResult;
    }
}
