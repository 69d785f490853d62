package mosaic.beamforming.calculator;

import mosaic.beamforming.model.PackingResult;

/**
 * 椭圆排布引擎
 *
 * 宽度为给定重叠度下的半宽（度），角度为椭圆长轴方向（度）
 */
public interface PackingEngine {

    /**
     * 求 beamNum 个椭圆最紧凑的排布
     *
     * @param precision 搜索精度，越大越优、越慢
     * @return 恰好 beamNum 个中心坐标及外接半径
     */
    PackingResult compact(int beamNum, double widthH, double widthV, double angle, int precision);

    /**
     * 返回半径 radius 内规则椭圆网格上的全部中心
     */
    double[][] grid(double radius, double widthH, double widthV, double angle);
}
