package mosaic.helper;

import mosaic.beamforming.model.AntennaPosition;

import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.errors.OrekitException;
import org.orekit.errors.OrekitIllegalStateException;
import org.orekit.frames.Frame;
import org.orekit.frames.FramesFactory;
import org.orekit.frames.TopocentricFrame;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 地球模型
 *
 * WGS84椭球上的地理坐标与地心直角坐标、站心ENU坐标之间的转换。
 * 只做几何换算，不涉及坐标系之间的时变变换。
 */
public class EarthModel {

    private static final Logger logger = Logger.getLogger(EarthModel.class.getName());

    private Frame bodyFrame;
    private OneAxisEllipsoid earth;

    public EarthModel() {
        initializeFrames();
    }

    /**
     * 初始化坐标系和地球模型
     */
    private void initializeFrames() {
        try {
            this.bodyFrame = FramesFactory.getITRF(IERSConventions.IERS_2010, true);
        } catch (OrekitException | OrekitIllegalStateException e) {
            // 没有EOP数据时ITRF不可用；此处只用椭球几何，退回GCRF作为载体坐标系
            logger.fine("ITRF unavailable, using GCRF as body frame: " + e.getMessage());
            this.bodyFrame = FramesFactory.getGCRF();
        }
        this.earth = new OneAxisEllipsoid(
            Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
            Constants.WGS84_EARTH_FLATTENING,
            bodyFrame
        );
    }

    public OneAxisEllipsoid getEarth() {
        return earth;
    }

    /**
     * 地理坐标转地心直角坐标（米）
     */
    public Vector3D toCartesian(AntennaPosition antenna) {
        return earth.transform(antenna.toGeodeticPoint());
    }

    /**
     * 以参考点为原点的站心坐标系
     */
    public TopocentricFrame topocentric(AntennaPosition reference) {
        return new TopocentricFrame(earth, reference.toGeodeticPoint(), reference.getId());
    }

    /**
     * 计算天线相对参考点的东、北、天向偏移（米）
     *
     * @param antenna 天线
     * @param reference 参考点
     * @return [E, N, U]
     */
    public double[] enuOffset(AntennaPosition antenna, AntennaPosition reference) {
        return enuOffset(antenna, toCartesian(reference), topocentric(reference));
    }

    /**
     * 批量计算ENU偏移，参考点只换算一次
     */
    public double[][] enuOffsets(Iterable<AntennaPosition> antennas, AntennaPosition reference) {
        Vector3D origin = toCartesian(reference);
        TopocentricFrame topo = topocentric(reference);
        List<double[]> rows = new ArrayList<>();
        for (AntennaPosition antenna : antennas) {
            rows.add(enuOffset(antenna, origin, topo));
        }
        return rows.toArray(new double[0][]);
    }

    private double[] enuOffset(AntennaPosition antenna, Vector3D origin, TopocentricFrame topo) {
        Vector3D offset = toCartesian(antenna).subtract(origin);
        return new double[]{
            Vector3D.dotProduct(offset, topo.getEast()),
            Vector3D.dotProduct(offset, topo.getNorth()),
            Vector3D.dotProduct(offset, topo.getZenith())
        };
    }
}
