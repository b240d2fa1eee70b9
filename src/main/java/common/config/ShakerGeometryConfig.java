package common.config;

import common.consts.VialTargetEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import model.bo.MotionGeometry;
import model.entity.Point;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 振荡几何与速度配置
 * 所有半径 中心 速度上下限统一在这里管理，避免在代码各处硬编码。
 *
 * 缺省值即设备标定值，可以通过 Spring 配置文件覆盖：
 *
 * shaker.geometry.orbital-radius
 * shaker.geometry.min-feed-rate
 * shaker.geometry.max-samples
 * shaker.geometry.targets.[target_A].x
 */
@Configuration
@ConfigurationProperties(prefix = "shaker.geometry")
@Data
public class ShakerGeometryConfig {

    /**
     * 默认中心坐标 (毫米)
     */
    private double centerX = 150.0;
    private double centerY = 150.0;
    private double centerZ = 10.0;

    /**
     * ORBITAL 结束后的统一回位原点
     */
    private double originX = 150.0;
    private double originY = 150.0;

    private double orbitalRadius = 5.0;
    private double linearAmplitude = 25.0;
    private double helicalRadius = 10.0;
    private double helicalAmplitudeZ = 5.0;

    /**
     * 最低进给速度 (mm/min) 防止过慢或停滞
     */
    private double minFeedRate = 2000.0;

    /**
     * Z 轴最大进给速度 (15 mm/s * 60)
     */
    private double maxZFeedRate = 900.0;

    private int travelFeedRate = 6000;
    private int targetMoveFeedRate = 3000;

    /**
     * 采样密度 (次/秒): 持续时间 ≤ short-duration-sec 用 default，≤ medium-duration-sec 用 medium，其余用 long
     * 直线 / 3D 模式固定使用 default
     */
    private int defaultSamplesPerSec = 50;
    private int mediumSamplesPerSec = 30;
    private int longSamplesPerSec = 20;
    private double shortDurationSec = 5.0;
    private double mediumDurationSec = 10.0;

    /**
     * 单次运动的采样点上限 超出时请求被拒绝 (400)
     */
    private int maxSamples = 100_000;

    private Map<String, Coordinate> targets = defaultTargets();

    @Bean
    public MotionGeometry motionGeometry() {
        MotionGeometry.MotionGeometryBuilder builder = MotionGeometry.builder()
                .centerX(centerX).centerY(centerY).centerZ(centerZ)
                .originX(originX).originY(originY)
                .orbitalRadius(orbitalRadius)
                .linearAmplitude(linearAmplitude)
                .helicalRadius(helicalRadius)
                .helicalAmplitudeZ(helicalAmplitudeZ)
                .minFeedRate(minFeedRate)
                .maxZFeedRate(maxZFeedRate)
                .travelFeedRate(travelFeedRate)
                .targetMoveFeedRate(targetMoveFeedRate)
                .defaultSamplesPerSec(defaultSamplesPerSec)
                .mediumSamplesPerSec(mediumSamplesPerSec)
                .longSamplesPerSec(longSamplesPerSec)
                .shortDurationSec(shortDurationSec)
                .mediumDurationSec(mediumDurationSec)
                .maxSamples(maxSamples);
        targets.forEach((code, c) -> {
            VialTargetEnum target = VialTargetEnum.getByCode(code);
            if (target == null) {
                throw new IllegalStateException("未知的目标配置: " + code);
            }
            builder.target(target, new Point(c.getX(), c.getY(), c.getZ()));
        });
        return builder.build();
    }

    private static Map<String, Coordinate> defaultTargets() {
        Map<String, Coordinate> map = new LinkedHashMap<>();
        map.put(VialTargetEnum.TARGET_A.getCode(), new Coordinate(100, 150, 0));
        map.put(VialTargetEnum.TARGET_B.getCode(), new Coordinate(150, 100, 0));
        return map;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Coordinate {
        private double x;
        private double y;
        private double z; // 0 表示定位时省略 Z 轴
    }
}
