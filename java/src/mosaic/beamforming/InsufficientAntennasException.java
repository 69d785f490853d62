package mosaic.beamforming;

/**
 * 天线数量不足（少于3根）时无法拟合波束椭圆
 */
public class InsufficientAntennasException extends MosaicException {

    private static final long serialVersionUID = 1L;

    private final int antennaCount;
    private final int minimumCount;

    public InsufficientAntennasException(int antennaCount, int minimumCount) {
        super("the number of antennas should be not less than " + minimumCount
                + ", got " + antennaCount);
        this.antennaCount = antennaCount;
        this.minimumCount = minimumCount;
    }

    public int getAntennaCount() {
        return antennaCount;
    }

    public int getMinimumCount() {
        return minimumCount;
    }
}
