package model.bo;

import common.consts.MotionPatternEnum;
import lombok.Value;
import model.entity.Point;

import java.util.List;

/**
 * 采样后的运动轨迹 (不可变)
 */
@Value
public class Trajectory {
    MotionPatternEnum pattern;
    // 起始/复位所用的中心坐标
    Point center;
    List<Point> points;
    // 指令进给速度 (mm/min)
    double feedRate;
    int samplesPerSec;
    double rps;
    double omega;

    public Trajectory(MotionPatternEnum pattern, Point center, List<Point> points,
                      double feedRate, int samplesPerSec, double rps, double omega) {
        this.pattern = pattern;
        this.center = center;
        this.points = List.copyOf(points);
        this.feedRate = feedRate;
        this.samplesPerSec = samplesPerSec;
        this.rps = rps;
        this.omega = omega;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
