package common.exception;

import common.consts.ErrorCodes;

/**
 * 与控制器交互时出现的未预期错误 只暴露异常类型和消息
 */
public class KlipperInternalException extends KlipperException {

    public KlipperInternalException(Throwable cause) {
        super(ErrorCodes.KLIPPER_INTERNAL, ErrorCodes.KLIPPER_INTERNAL_ERROR,
                "预期外的错误: " + cause.getClass().getSimpleName() + " - " + cause.getMessage(), 500, cause);
    }
}
