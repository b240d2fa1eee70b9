package common.exception;

import lombok.Getter;

/**
 * Klipper/Moonraker 通信异常的基类
 * message 面向调用方, detail 保留原始错误信息便于排查
 */
@Getter
public class KlipperException extends RuntimeException {

    private final String errorCode;
    private final String detail;
    private final int httpStatus;

    public KlipperException(String message, String errorCode, String detail, int httpStatus) {
        this(message, errorCode, detail, httpStatus, null);
    }

    public KlipperException(String message, String errorCode, String detail, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.detail = detail != null ? detail : message;
        this.httpStatus = httpStatus;
    }
}
