package model.bo;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * 一次调度的结果
 */
@Value
public class DispatchResult {
    MotionRequest request;
    Trajectory trajectory;
    String script;
    int gcodeLines;
    JsonNode moonrakerResponse;
    // 仅 ORBITAL 有回原点响应
    JsonNode homeResponse;
}
