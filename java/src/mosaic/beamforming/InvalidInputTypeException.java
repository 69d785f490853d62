package mosaic.beamforming;

/**
 * 坐标、目标或时间参数既不是可识别的字面量，也不是可识别的外部句柄
 */
public class InvalidInputTypeException extends MosaicException {

    private static final long serialVersionUID = 1L;

    private final String argumentName;

    public InvalidInputTypeException(String argumentName, Object value) {
        super("unsupported " + argumentName + " input: "
                + (value == null ? "null" : value.getClass().getName()));
        this.argumentName = argumentName;
    }

    public InvalidInputTypeException(String argumentName, String message) {
        super("invalid " + argumentName + " input: " + message);
        this.argumentName = argumentName;
    }

    public String getArgumentName() {
        return argumentName;
    }
}
