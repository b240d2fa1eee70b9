package common.consts;

/**
 * 全局错误信息与错误码常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";
    public static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";

    //  参数错误
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_RPM = "rpm 必须大于 0";
    public static final String INVALID_DURATION = "time_sec 必须大于 0";
    public static final String TARGET_REQUIRED = "必须指定目标位置 (target_A 或 target_B)";
    public static final String UNKNOWN_TARGET = "未知的目标位置";
    public static final String TOO_MANY_SAMPLES = "持续时间过长 采样点数超出上限";

    // 控制器 (Klipper/Moonraker) 错误码
    public static final String KLIPPER_CONNECTION_ERROR = "KLIPPER_CONNECTION_ERROR";
    public static final String KLIPPER_HTTP_ERROR = "KLIPPER_HTTP_ERROR";
    public static final String KLIPPER_GCODE_ERROR = "KLIPPER_GCODE_ERROR";
    public static final String KLIPPER_HOMING_REQUIRED = "KLIPPER_HOMING_REQUIRED";
    public static final String KLIPPER_INTERNAL_ERROR = "KLIPPER_INTERNAL_ERROR";

    // 控制器错误信息
    public static final String KLIPPER_UNREACHABLE = "无法连接 Klipper 服务器";
    public static final String PRINTER_INFO_FAILED = "打印机信息查询失败";
    public static final String GCODE_SEND_FAILED = "G-code 指令发送失败";
    public static final String KLIPPER_INTERNAL = "服务器内部错误";
}
