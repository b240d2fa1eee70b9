package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 振荡运动模式
 */
@Getter
@AllArgsConstructor
public enum MotionPatternEnum {
    ORBITAL("orbital", "平面圆周轨道", true),
    LINEAR("linear", "Y轴直线往复", false),
    HELICAL_3D("3d", "圆周轨道 + Z轴同步摆动", false);

    private final String code;
    private final String desc;
    // 采样是否包含 t = time_sec 的终点
    private final boolean endpointInclusive;

    /**
     * 结束后是否需要用 G92 把当前位置重置为中心坐标
     * ORBITAL 改为单独下发回原点指令
     */
    public boolean rezeroAfterMotion() {
        return this != ORBITAL;
    }

    public boolean usesZAxis() {
        return this == HELICAL_3D;
    }
}
