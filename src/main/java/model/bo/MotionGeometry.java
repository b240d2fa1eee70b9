package model.bo;

import common.consts.VialTargetEnum;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import model.entity.Point;

import java.util.Map;

/**
 * 振荡运动的几何与速度参数 (不可变)
 * 由 ShakerGeometryConfig 生成后注入计算器和调度器，测试中可直接 builder 构造
 */
@Value
@Builder(toBuilder = true)
public class MotionGeometry {

    // 默认中心坐标
    @Builder.Default double centerX = 150.0;
    @Builder.Default double centerY = 150.0;
    @Builder.Default double centerZ = 10.0;

    // ORBITAL 模式已完成后统一回到的原点
    @Builder.Default double originX = 150.0;
    @Builder.Default double originY = 150.0;

    @Builder.Default double orbitalRadius = 5.0;
    @Builder.Default double linearAmplitude = 25.0;
    @Builder.Default double helicalRadius = 10.0;
    @Builder.Default double helicalAmplitudeZ = 5.0;

    // 速度 (mm/min)
    @Builder.Default double minFeedRate = 2000.0;
    @Builder.Default double maxZFeedRate = 900.0;
    @Builder.Default int travelFeedRate = 6000;
    @Builder.Default int targetMoveFeedRate = 3000;

    // 采样密度 (次/秒)
    @Builder.Default int defaultSamplesPerSec = 50;
    @Builder.Default int mediumSamplesPerSec = 30;
    @Builder.Default int longSamplesPerSec = 20;
    @Builder.Default double shortDurationSec = 5.0;
    @Builder.Default double mediumDurationSec = 10.0;
    // 单次运动的采样点上限 (20次/秒 约 83 分钟)
    @Builder.Default int maxSamples = 100_000;

    // z = 0 表示该目标的定位指令省略 Z 轴
    @Singular Map<VialTargetEnum, Point> targets;

    /**
     * 默认几何参数 包含 target_A / target_B 两个预设目标
     */
    public static MotionGeometry defaults() {
        return MotionGeometry.builder()
                .target(VialTargetEnum.TARGET_A, new Point(100, 150, 0.0))
                .target(VialTargetEnum.TARGET_B, new Point(150, 100, 0.0))
                .build();
    }

    public Point center() {
        return new Point(centerX, centerY, centerZ);
    }

    public Point origin() {
        return new Point(originX, originY);
    }
}
