package common.exception;

/**
 * 业务异常 (请求参数不合法等) 对外返回 400
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
