package mosaic.beamforming.model;

import mosaic.beamforming.InvalidInputTypeException;

import org.orekit.bodies.GeodeticPoint;
import org.orekit.frames.TopocentricFrame;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * 阵列几何
 *
 * 有序、不可变的天线列表。顺序本身没有物理含义，但延迟结果按此顺序
 * 与天线一一对应，因此必须保持。
 */
public final class AntennaGeometry implements Iterable<AntennaPosition>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final String DEFAULT_ID_PREFIX = "ant";

    private final List<AntennaPosition> antennas;

    public AntennaGeometry(List<AntennaPosition> antennas) {
        Set<String> ids = new HashSet<>();
        for (AntennaPosition antenna : antennas) {
            if (!ids.add(antenna.getId())) {
                throw new IllegalArgumentException("duplicate antenna id: " + antenna.getId());
            }
        }
        this.antennas = Collections.unmodifiableList(new ArrayList<>(antennas));
    }

    /**
     * 在边界处一次性解析天线输入
     *
     * 每个元素可以是 [纬度, 经度, 海拔] 字面量（double[] 或数字列表）、
     * AntennaPosition、Orekit GeodeticPoint（弧度）或 TopocentricFrame（测站句柄）
     *
     * @param inputs 天线输入列表
     * @return 规范化后的阵列几何
     * @throws InvalidInputTypeException 元素类型无法识别
     */
    public static AntennaGeometry of(List<?> inputs) {
        if (inputs == null) {
            throw new InvalidInputTypeException("antennas", (Object) null);
        }
        List<AntennaPosition> resolved = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            resolved.add(resolveAntenna(inputs.get(i), DEFAULT_ID_PREFIX + i));
        }
        return new AntennaGeometry(resolved);
    }

    /**
     * 解析单根天线
     *
     * @param input 天线输入
     * @param defaultId 字面量输入没有标识时使用的标识
     */
    public static AntennaPosition resolveAntenna(Object input, String defaultId) {
        if (input instanceof AntennaPosition) {
            return (AntennaPosition) input;
        }
        if (input instanceof TopocentricFrame) {
            TopocentricFrame station = (TopocentricFrame) input;
            return AntennaPosition.fromGeodeticPoint(station.getName(), station.getPoint());
        }
        if (input instanceof GeodeticPoint) {
            return AntennaPosition.fromGeodeticPoint(defaultId, (GeodeticPoint) input);
        }
        double[] literal = toLiteral(input);
        return new AntennaPosition(defaultId, literal[0], literal[1], literal[2]);
    }

    private static double[] toLiteral(Object input) {
        if (input instanceof double[]) {
            double[] values = (double[]) input;
            if (values.length != 3) {
                throw new InvalidInputTypeException("antenna",
                        "expected [latitude, longitude, altitude], got " + values.length + " values");
            }
            return values.clone();
        }
        if (input instanceof List) {
            List<?> values = (List<?>) input;
            if (values.size() != 3) {
                throw new InvalidInputTypeException("antenna",
                        "expected [latitude, longitude, altitude], got " + values.size() + " values");
            }
            double[] literal = new double[3];
            for (int i = 0; i < 3; i++) {
                Object value = values.get(i);
                if (!(value instanceof Number)) {
                    throw new InvalidInputTypeException("antenna", value);
                }
                literal[i] = ((Number) value).doubleValue();
            }
            return literal;
        }
        throw new InvalidInputTypeException("antenna", input);
    }

    public int size() {
        return antennas.size();
    }

    public AntennaPosition get(int index) {
        return antennas.get(index);
    }

    public List<AntennaPosition> asList() {
        return antennas;
    }

    /**
     * @return 每行 [纬度, 经度, 海拔]
     */
    public double[][] toArray() {
        double[][] rows = new double[antennas.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = antennas.get(i).toArray();
        }
        return rows;
    }

    @Override
    public Iterator<AntennaPosition> iterator() {
        return antennas.iterator();
    }

    @Override
    public String toString() {
        return "AntennaGeometry{" +
                "antennas=" + antennas.size() +
                '}';
    }
}
