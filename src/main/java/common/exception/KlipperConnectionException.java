package common.exception;

import common.consts.ErrorCodes;

/**
 * 控制器不可达或超时 统一视为服务不可用 (503)
 */
public class KlipperConnectionException extends KlipperException {

    public KlipperConnectionException(String detail, Throwable cause) {
        super(ErrorCodes.KLIPPER_UNREACHABLE, ErrorCodes.KLIPPER_CONNECTION_ERROR, detail, 503, cause);
    }
}
