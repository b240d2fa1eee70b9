package common.exception;

import common.consts.ErrorCodes;

import java.util.Locale;

/**
 * 控制器报告坐标轴尚未归零 ("Must home axis first")
 * 由调度器内部消化 只有自动归零后仍然失败才会抛给调用方
 */
public class HomingRequiredException extends KlipperResponseException {

    private static final String HOMING_MARKER = "must home";

    public HomingRequiredException(int status, String responseText) {
        super(ErrorCodes.GCODE_SEND_FAILED, ErrorCodes.KLIPPER_HOMING_REQUIRED, status, responseText);
    }

    /**
     * 响应文本是否表示需要先归零 (不区分大小写)
     */
    public static boolean matches(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(HOMING_MARKER);
    }
}
