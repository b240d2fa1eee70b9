package model.dto.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import model.entity.Point;

import java.util.Map;

/**
 * 振荡执行结果
 * homeResponse / homePosition 只有 ORBITAL 模式才有
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ShakeResp {
    private Map<String, Object> parameters;
    private Integer gcodeLines;
    private JsonNode moonrakerResponse;
    private JsonNode homeResponse;
    private Point homePosition;
}
