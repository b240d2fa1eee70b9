package model.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import common.consts.VialTargetEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 轨道模式请求 在指定目标位置做圆周振荡
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrbitalShakeReq {
    private VialTargetEnum target;  // target_A 或 target_B
    private Integer rpm;            // 每分钟转数 (> 0)
    @JsonAlias("durationSeconds")
    private Double timeSec;         // 持续时间 秒 (> 0)
}
