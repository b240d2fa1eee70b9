package common.exception;

/**
 * 控制器返回了 4xx/5xx 响应
 */
public class KlipperResponseException extends KlipperException {

    private final String responseText;

    public KlipperResponseException(String message, String errorCode, int status, String responseText) {
        super(message, errorCode, "Klipper 服务器错误 (" + status + "): " + responseText, status);
        this.responseText = responseText;
    }

    public String getResponseText() {
        return responseText;
    }
}
