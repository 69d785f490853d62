package mosaic.beamforming.model;

/**
 * 排布引擎的输出：波束中心坐标（度）及外接半径（度）
 */
public final class PackingResult {
    private final double[][] coordinates;
    private final double radius;

    public PackingResult(double[][] coordinates, double radius) {
        this.coordinates = copy(coordinates);
        this.radius = radius;
    }

    public double[][] getCoordinates() { return copy(coordinates); }
    public double getRadius() { return radius; }
    public int size() { return coordinates.length; }

    static double[][] copy(double[][] rows) {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }
}
