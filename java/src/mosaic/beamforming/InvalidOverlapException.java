package mosaic.beamforming;

/**
 * 重叠度不在开区间 (0, 1) 内
 */
public class InvalidOverlapException extends MosaicException {

    private static final long serialVersionUID = 1L;

    private final double overlap;

    public InvalidOverlapException(double overlap) {
        super("overlap should be in the open interval (0, 1), got " + overlap);
        this.overlap = overlap;
    }

    public double getOverlap() {
        return overlap;
    }
}
