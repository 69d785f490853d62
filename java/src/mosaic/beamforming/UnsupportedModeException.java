package mosaic.beamforming;

/**
 * 当前重叠计算模式不支持所请求的操作
 */
public class UnsupportedModeException extends MosaicException {

    private static final long serialVersionUID = 1L;

    public UnsupportedModeException(String message) {
        super(message);
    }
}
