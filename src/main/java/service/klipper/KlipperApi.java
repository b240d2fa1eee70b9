package service.klipper;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Klipper/Moonraker HTTP API
 * 所有失败都以 KlipperException 子类抛出，不会静默吞掉
 */
public interface KlipperApi {

    /** 状态查询 GET /printer/info 原样返回控制器的 JSON */
    JsonNode getPrinterInfo();

    /** 指令下发 POST /printer/gcode/script 发送多行 G-code 脚本 */
    JsonNode sendGcode(String script);

    /** 全轴归零 (G28) */
    JsonNode homePrinter();

    /** 暂停当前动作 */
    JsonNode pausePrinter();
}
