package service.motion;

import common.consts.ErrorCodes;
import common.consts.MotionPatternEnum;
import common.consts.VialTargetEnum;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.bo.MotionGeometry;
import model.bo.MotionRequest;
import model.bo.Trajectory;
import model.entity.Point;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 运动轨迹计算器
 * 根据 rpm / 持续时间 / 运动模式 计算采样点和进给速度
 * 同样的输入总是得到同样的轨迹 (不依赖随机数和系统时钟)
 */
@Slf4j
@Component
public class MotionProfileCalculator {

    private final MotionGeometry geometry;

    public MotionProfileCalculator(MotionGeometry geometry) {
        this.geometry = geometry;
    }

    public Trajectory calculate(MotionRequest req) {
        double rps = req.getRpm() / 60.0;
        double omega = 2 * Math.PI * rps;

        Trajectory trajectory;
        switch (req.getPattern()) {
            case ORBITAL:
                trajectory = orbital(req, rps, omega);
                break;
            case LINEAR:
                trajectory = linear(req, rps, omega);
                break;
            case HELICAL_3D:
                trajectory = helical(req, rps, omega);
                break;
            default:
                throw new IllegalArgumentException("不支持的运动模式: " + req.getPattern());
        }

        log.info("[{}] 轨迹参数 rpm={}, time_sec={}, rps={}, omega={}, center=({}, {}), F={}, 采样点数={}",
                req.getPattern(), req.getRpm(), req.getTimeSec(),
                String.format("%.4f", rps), String.format("%.4f", omega),
                trajectory.getCenter().getX(), trajectory.getCenter().getY(),
                (int) trajectory.getFeedRate(), trajectory.size());
        return trajectory;
    }

    /**
     * 采样密度随持续时间递减 控制总指令数
     * ≤5s: 50次/秒, ≤10s: 30次/秒, 其余: 20次/秒
     */
    public int orbitalSamplesPerSec(double timeSec) {
        if (timeSec <= geometry.getShortDurationSec()) {
            return geometry.getDefaultSamplesPerSec();
        } else if (timeSec <= geometry.getMediumDurationSec()) {
            return geometry.getMediumSamplesPerSec();
        }
        return geometry.getLongSamplesPerSec();
    }

    /**
     * 目标位置坐标 未配置时抛出业务异常
     */
    public Point targetCoordinate(VialTargetEnum target) {
        Point coordinate = target == null ? null : geometry.getTargets().get(target);
        if (coordinate == null) {
            throw new BusinessException(ErrorCodes.UNKNOWN_TARGET + ": " + target);
        }
        return coordinate;
    }

    private Trajectory orbital(MotionRequest req, double rps, double omega) {
        Point center = new Point(geometry.getCenterX(), geometry.getCenterY());
        if (req.getTarget() != null) {
            Point target = targetCoordinate(req.getTarget());
            center = new Point(target.getX(), target.getY());
        }
        double radius = geometry.getOrbitalRadius();
        double feedRate = Math.max(geometry.getMinFeedRate(), 2 * Math.PI * radius * rps * 60);

        int samplesPerSec = orbitalSamplesPerSec(req.getTimeSec());
        int count = sampleCount(req, samplesPerSec);

        List<Point> points = new ArrayList<>(count);
        for (double t : sampleTimes(req, count)) {
            points.add(new Point(
                    radius * Math.cos(omega * t) + center.getX(),
                    radius * Math.sin(omega * t) + center.getY()));
        }
        return new Trajectory(MotionPatternEnum.ORBITAL, center, points, feedRate, samplesPerSec, rps, omega);
    }

    private Trajectory linear(MotionRequest req, double rps, double omega) {
        Point center = new Point(geometry.getCenterX(), geometry.getCenterY());
        double amplitude = geometry.getLinearAmplitude();
        // 一个周期走四个半行程
        double feedRate = Math.max(geometry.getMinFeedRate(), 4 * amplitude * rps * 60);

        int samplesPerSec = geometry.getDefaultSamplesPerSec();
        int count = sampleCount(req, samplesPerSec);

        List<Point> points = new ArrayList<>(count);
        for (double t : sampleTimes(req, count)) {
            points.add(new Point(center.getX(), amplitude * Math.sin(omega * t) + center.getY()));
        }
        return new Trajectory(MotionPatternEnum.LINEAR, center, points, feedRate, samplesPerSec, rps, omega);
    }

    private Trajectory helical(MotionRequest req, double rps, double omega) {
        Point center = geometry.center();
        double radius = geometry.getHelicalRadius();
        double halfAmplitudeZ = geometry.getHelicalAmplitudeZ() / 2.0;
        // Z 轴速度不能超过控制器额定上限
        double feedRate = Math.min(
                Math.max(geometry.getMinFeedRate(), 2 * Math.PI * radius * rps * 60),
                geometry.getMaxZFeedRate());

        int samplesPerSec = geometry.getDefaultSamplesPerSec();
        int count = sampleCount(req, samplesPerSec);

        List<Point> points = new ArrayList<>(count);
        for (double t : sampleTimes(req, count)) {
            points.add(new Point(
                    radius * Math.cos(omega * t) + center.getX(),
                    radius * Math.sin(omega * t) + center.getY(),
                    halfAmplitudeZ * Math.sin(omega * t) + center.getZ()));
        }
        return new Trajectory(MotionPatternEnum.HELICAL_3D, center, points, feedRate, samplesPerSec, rps, omega);
    }

    /**
     * 采样点数 floor(time_sec * 密度)，包含终点的模式再 +1
     * 超过 maxSamples 时拒绝，避免超长持续时间生成无法下发的脚本
     */
    int sampleCount(MotionRequest req, int samplesPerSec) {
        double count = Math.floor(req.getTimeSec() * samplesPerSec);
        if (req.getPattern().isEndpointInclusive()) {
            count += 1;
        }
        if (count > geometry.getMaxSamples()) {
            throw new BusinessException(ErrorCodes.TOO_MANY_SAMPLES + ": " + (long) count
                    + " > " + geometry.getMaxSamples());
        }
        return (int) count;
    }

    private static double[] sampleTimes(MotionRequest req, int count) {
        return sampleTimes(req.getTimeSec(), count, req.getPattern().isEndpointInclusive());
    }

    /**
     * [0, timeSec] 上均匀分布的 count 个采样时刻
     * inclusive=true 时最后一个时刻等于 timeSec (count == 1 时只有 t = 0)
     */
    static double[] sampleTimes(double timeSec, int count, boolean inclusive) {
        double[] times = new double[Math.max(count, 0)];
        if (count <= 0) {
            return times;
        }
        int divisions = inclusive ? count - 1 : count;
        double step = divisions > 0 ? timeSec / divisions : 0.0;
        for (int i = 0; i < count; i++) {
            times[i] = i * step;
        }
        if (inclusive && count > 1) {
            times[count - 1] = timeSec;
        }
        return times;
    }
}
