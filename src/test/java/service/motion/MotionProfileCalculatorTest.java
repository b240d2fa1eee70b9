package service.motion;

import common.consts.ErrorCodes;
import common.consts.MotionPatternEnum;
import common.consts.VialTargetEnum;
import common.exception.BusinessException;
import model.bo.MotionGeometry;
import model.bo.MotionRequest;
import model.bo.Trajectory;
import model.entity.Point;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 轨迹计算测试
 */
@DisplayName("运动轨迹计算测试")
class MotionProfileCalculatorTest {

    private static final double EPS = 1e-9;

    private MotionProfileCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new MotionProfileCalculator(MotionGeometry.defaults());
    }

    @Test
    @DisplayName("轨道模式 rpm=60 1秒 target_A 的完整示例")
    void testOrbitalAtTargetA() {
        Trajectory t = calculator.calculate(MotionRequest.orbital(60, 1.0, VialTargetEnum.TARGET_A));

        assertEquals(MotionPatternEnum.ORBITAL, t.getPattern());
        assertEquals(100.0, t.getCenter().getX(), EPS);
        assertEquals(150.0, t.getCenter().getY(), EPS);
        assertEquals(1.0, t.getRps(), EPS);
        assertEquals(2 * Math.PI, t.getOmega(), EPS);
        assertEquals(51, t.size(), "50次/秒 * 1秒 + 1");
        // 2π*5*1*60 ≈ 1885 低于下限
        assertEquals(2000.0, t.getFeedRate(), EPS);

        Point first = t.getPoints().get(0);
        assertEquals(105.0, first.getX(), EPS);
        assertEquals(150.0, first.getY(), EPS);
        assertFalse(first.hasZ());
    }

    @ParameterizedTest(name = "time_sec={0} -> {1}次/秒, {2}个点")
    @CsvSource({
            "1.0, 50, 51",
            "2.5, 50, 126",
            "5.0, 50, 251",
            "7.5, 30, 226",
            "10.0, 30, 301",
            "12.0, 20, 241"
    })
    @DisplayName("轨道模式采样密度分三档 且包含终点")
    void testOrbitalSampleDensity(double timeSec, int density, int expectedCount) {
        Trajectory t = calculator.calculate(MotionRequest.orbital(120, timeSec, VialTargetEnum.TARGET_B));

        assertEquals(density, t.getSamplesPerSec());
        assertEquals(expectedCount, t.size());
    }

    @Test
    @DisplayName("轨道模式首末采样角度分别为 0 和 omega*time_sec")
    void testOrbitalEndpointAngles() {
        double timeSec = 2.5;
        Trajectory t = calculator.calculate(MotionRequest.orbital(45, timeSec, VialTargetEnum.TARGET_A));
        Point center = t.getCenter();
        double radius = MotionGeometry.defaults().getOrbitalRadius();

        Point first = t.getPoints().get(0);
        assertEquals(radius + center.getX(), first.getX(), EPS);
        assertEquals(center.getY(), first.getY(), EPS);

        Point last = t.getPoints().get(t.size() - 1);
        double angle = t.getOmega() * timeSec;
        assertEquals(radius * Math.cos(angle) + center.getX(), last.getX(), EPS);
        assertEquals(radius * Math.sin(angle) + center.getY(), last.getY(), EPS);
    }

    @Test
    @DisplayName("轨道模式高转速时进给速度按切向速度计算")
    void testOrbitalFeedRateAboveFloor() {
        Trajectory t = calculator.calculate(MotionRequest.orbital(120, 1.0, VialTargetEnum.TARGET_A));
        assertEquals(2 * Math.PI * 5.0 * 2.0 * 60, t.getFeedRate(), EPS);
    }

    @Test
    @DisplayName("直线模式只在 Y 轴往复 且不包含终点")
    void testLinearTrajectory() {
        Trajectory t = calculator.calculate(MotionRequest.linear(60, 1.0));

        assertEquals(50, t.size());
        for (Point p : t.getPoints()) {
            assertEquals(150.0, p.getX(), EPS);
            assertTrue(p.getY() >= 125.0 - EPS && p.getY() <= 175.0 + EPS);
        }
        // 最后一个采样在 t = 49/50 秒
        Point last = t.getPoints().get(49);
        assertEquals(25.0 * Math.sin(2 * Math.PI * 0.98) + 150.0, last.getY(), EPS);
        // 半个周期回到中心
        assertEquals(150.0, t.getPoints().get(25).getY(), 1e-6);
    }

    @ParameterizedTest(name = "rpm={0} -> F={1}")
    @CsvSource({
            "10, 2000",
            "60, 6000",
            "120, 12000"
    })
    @DisplayName("直线模式进给速度 = max(2000, 4*A*rps*60)")
    void testLinearFeedRate(int rpm, double expected) {
        Trajectory t = calculator.calculate(MotionRequest.linear(rpm, 1.0));
        assertEquals(expected, t.getFeedRate(), EPS);
    }

    @Test
    @DisplayName("3D 模式 Z 轴与 XY 同相摆动 进给速度被 Z 轴上限限制")
    void testHelicalTrajectory() {
        Trajectory t = calculator.calculate(MotionRequest.helical(60, 2.0));

        assertEquals(100, t.size());
        assertEquals(900.0, t.getFeedRate(), EPS);

        Point first = t.getPoints().get(0);
        assertEquals(160.0, first.getX(), EPS);
        assertEquals(150.0, first.getY(), EPS);
        assertEquals(10.0, first.getZ(), EPS);

        for (int i = 0; i < t.size(); i++) {
            Point p = t.getPoints().get(i);
            double angle = t.getOmega() * (i * 2.0 / 100);
            assertEquals(10.0 * Math.sin(angle) + 150.0, p.getY(), EPS);
            assertEquals(2.5 * Math.sin(angle) + 10.0, p.getZ(), EPS);
        }
    }

    @ParameterizedTest(name = "rpm={0}")
    @CsvSource({"1", "30", "60", "300", "3000"})
    @DisplayName("3D 模式进给速度从不超过 900")
    void testHelicalFeedRateCeiling(int rpm) {
        Trajectory t = calculator.calculate(MotionRequest.helical(rpm, 1.0));
        assertTrue(t.getFeedRate() <= 900.0);
    }

    @ParameterizedTest(name = "rpm={0}")
    @CsvSource({"1", "7", "60", "600"})
    @DisplayName("轨道/直线模式进给速度从不低于 2000")
    void testFeedRateFloor(int rpm) {
        assertTrue(calculator.calculate(MotionRequest.orbital(rpm, 1.0, VialTargetEnum.TARGET_A)).getFeedRate() >= 2000.0);
        assertTrue(calculator.calculate(MotionRequest.linear(rpm, 1.0)).getFeedRate() >= 2000.0);
    }

    @Test
    @DisplayName("持续时间小于一个采样间隔时 直线/3D 没有采样点 轨道只有起点")
    void testTooShortDuration() {
        assertTrue(calculator.calculate(MotionRequest.linear(60, 0.01)).isEmpty());
        assertTrue(calculator.calculate(MotionRequest.helical(60, 0.01)).isEmpty());

        List<Point> orbital = calculator.calculate(MotionRequest.orbital(60, 0.01, VialTargetEnum.TARGET_A)).getPoints();
        assertEquals(1, orbital.size());
        assertEquals(105.0, orbital.get(0).getX(), EPS);
    }

    @Test
    @DisplayName("自定义几何参数生效")
    void testCustomGeometry() {
        MotionGeometry geometry = MotionGeometry.defaults().toBuilder()
                .orbitalRadius(8.0)
                .minFeedRate(500.0)
                .build();
        MotionProfileCalculator custom = new MotionProfileCalculator(geometry);

        Trajectory t = custom.calculate(MotionRequest.orbital(60, 1.0, VialTargetEnum.TARGET_B));
        assertEquals(158.0, t.getPoints().get(0).getX(), EPS);
        assertEquals(100.0, t.getPoints().get(0).getY(), EPS);
        assertEquals(2 * Math.PI * 8.0 * 60, t.getFeedRate(), EPS);
    }

    @Test
    @DisplayName("非法请求参数被拒绝")
    void testInvalidRequests() {
        assertThrows(BusinessException.class, () -> MotionRequest.linear(0, 1.0));
        assertThrows(BusinessException.class, () -> MotionRequest.linear(-5, 1.0));
        assertThrows(BusinessException.class, () -> MotionRequest.linear(60, 0.0));
        assertThrows(BusinessException.class, () -> MotionRequest.helical(60, Double.NaN));
        assertThrows(BusinessException.class, () -> MotionRequest.helical(null, 1.0));
        assertThrows(BusinessException.class, () -> MotionRequest.orbital(60, 1.0, null));
    }

    @Test
    @DisplayName("未配置的目标位置抛出业务异常")
    void testUnknownTarget() {
        MotionProfileCalculator noTargets = new MotionProfileCalculator(MotionGeometry.builder().build());
        assertThrows(BusinessException.class,
                () -> noTargets.calculate(MotionRequest.orbital(60, 1.0, VialTargetEnum.TARGET_A)));
    }

    @Test
    @DisplayName("超长持续时间被拒绝 而不是生成巨量采样点")
    void testDurationTooLong() {
        BusinessException orbital = assertThrows(BusinessException.class,
                () -> calculator.calculate(MotionRequest.orbital(60, 2e8, VialTargetEnum.TARGET_A)));
        assertTrue(orbital.getMessage().startsWith(ErrorCodes.TOO_MANY_SAMPLES));
        assertThrows(BusinessException.class, () -> calculator.calculate(MotionRequest.linear(60, 1e9)));
        assertThrows(BusinessException.class, () -> calculator.calculate(MotionRequest.helical(60, 1e9)));
        assertThrows(BusinessException.class, () -> calculator.calculate(MotionRequest.linear(60, Double.MAX_VALUE)));
    }

    @Test
    @DisplayName("采样点数上限按配置生效 终点计入上限")
    void testMaxSamplesBoundary() {
        MotionGeometry geometry = MotionGeometry.defaults().toBuilder().maxSamples(100).build();
        MotionProfileCalculator limited = new MotionProfileCalculator(geometry);

        // 2 秒 * 50 次/秒 = 100 个点
        assertEquals(100, limited.calculate(MotionRequest.linear(60, 2.0)).size());
        assertThrows(BusinessException.class, () -> limited.calculate(MotionRequest.linear(60, 2.02)));
        // 轨道模式多一个终点: 101 个点超出上限
        assertThrows(BusinessException.class,
                () -> limited.calculate(MotionRequest.orbital(60, 2.0, VialTargetEnum.TARGET_A)));
        assertEquals(100, limited.calculate(MotionRequest.orbital(60, 1.99, VialTargetEnum.TARGET_A)).size());
    }

    @Test
    @DisplayName("采样时刻是否包含终点由运动模式决定")
    void testEndpointInclusiveByPattern() {
        assertTrue(MotionPatternEnum.ORBITAL.isEndpointInclusive());
        assertFalse(MotionPatternEnum.LINEAR.isEndpointInclusive());
        assertFalse(MotionPatternEnum.HELICAL_3D.isEndpointInclusive());

        MotionRequest orbital = MotionRequest.orbital(60, 1.0, VialTargetEnum.TARGET_A);
        MotionRequest linear = MotionRequest.linear(60, 1.0);
        assertEquals(51, calculator.sampleCount(orbital, 50));
        assertEquals(50, calculator.sampleCount(linear, 50));
    }
}
