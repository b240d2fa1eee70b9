package common.consts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 预设的目标位置 (坐标在 shaker.geometry.targets 中配置)
 */
@Getter
@AllArgsConstructor
public enum VialTargetEnum {
    TARGET_A("target_A"),
    TARGET_B("target_B");

    @JsonValue
    private final String code;

    /**
     * 根据 code 获取枚举对象
     * @param code 目标编码
     * @return 对应的枚举对象 若未找到返回 null
     */
    @JsonCreator
    public static VialTargetEnum getByCode(String code) {
        for (VialTargetEnum value : values()) {
            if (value.getCode().equalsIgnoreCase(code)) {
                return value;
            }
        }
        return null;
    }
}
