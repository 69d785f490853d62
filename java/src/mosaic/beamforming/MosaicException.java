package mosaic.beamforming;

/**
 * 波束计算异常基类
 *
 * 所有输入校验错误均为非受检异常，立即抛给调用方，不做重试
 */
public class MosaicException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MosaicException(String message) {
        super(message);
    }

    public MosaicException(String message, Throwable cause) {
        super(message, cause);
    }
}
