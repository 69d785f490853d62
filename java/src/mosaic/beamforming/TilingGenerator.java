package mosaic.beamforming;

import mosaic.beamforming.calculator.EllipsePacker;
import mosaic.beamforming.calculator.PackingEngine;
import mosaic.beamforming.model.BeamWidth;
import mosaic.beamforming.model.PackingResult;

import java.util.logging.Logger;

/**
 * 排布生成器
 *
 * 由波束形状和重叠度推导椭圆半宽，交给排布引擎搜索中心坐标，再组装成 {@link Tiling}。
 * 波束数总是取自引擎返回的坐标个数。
 */
public class TilingGenerator {

    private static final Logger logger = Logger.getLogger(TilingGenerator.class.getName());

    public static final double DEFAULT_OVERLAP = 0.5;

    private final PackingEngine packer;
    private final MosaicConfig config;

    public TilingGenerator() {
        this(new MosaicConfig());
    }

    public TilingGenerator(MosaicConfig config) {
        this(new EllipsePacker(), config);
    }

    public TilingGenerator(PackingEngine packer, MosaicConfig config) {
        this.packer = packer;
        this.config = config;
    }

    public Tiling generateNBeamsTiling(BeamShape beamShape, int beamNum) {
        return generateNBeamsTiling(beamShape, beamNum, DEFAULT_OVERLAP);
    }

    /**
     * 生成给定波束数的最紧凑排布
     *
     * @param beamShape 波束形状
     * @param beamNum 波束数
     * @param overlap 相邻波束的重叠度，开区间 (0, 1)
     * @return 排布结果
     */
    public Tiling generateNBeamsTiling(BeamShape beamShape, int beamNum, double overlap) {
        if (beamNum < 1) {
            throw new IllegalArgumentException("beam number should be at least 1, got " + beamNum);
        }
        BeamWidth width = beamShape.widthAtOverlap(overlap);
        PackingResult packing = packer.compact(
            beamNum, width.getWidthH(), width.getWidthV(), beamShape.getAngle(),
            config.getPackingPrecision()
        );
        if (packing.size() != beamNum) {
            logger.warning(String.format("packing engine returned %d beams, %d requested",
                    packing.size(), beamNum));
        }
        return new Tiling(packing.getCoordinates(), beamShape, packing.getRadius(), overlap);
    }

    public Tiling generateRadiusTiling(BeamShape beamShape, double tilingRadius) {
        return generateRadiusTiling(beamShape, tilingRadius, DEFAULT_OVERLAP);
    }

    /**
     * 生成给定半径内的规则网格排布，波束数由排布结果决定
     *
     * @param beamShape 波束形状
     * @param tilingRadius 排布区域半径（度）
     * @param overlap 相邻波束的重叠度，开区间 (0, 1)
     * @return 排布结果
     */
    public Tiling generateRadiusTiling(BeamShape beamShape, double tilingRadius, double overlap) {
        if (!(tilingRadius >= 0)) {
            throw new IllegalArgumentException("tiling radius should be non-negative, got " + tilingRadius);
        }
        BeamWidth width = beamShape.widthAtOverlap(overlap);
        double[][] coordinates = packer.grid(
            tilingRadius, width.getWidthH(), width.getWidthV(), beamShape.getAngle()
        );
        logger.fine("radius tiling of " + tilingRadius + " deg holds " + coordinates.length + " beams");
        return new Tiling(coordinates, beamShape, tilingRadius, overlap);
    }
}
