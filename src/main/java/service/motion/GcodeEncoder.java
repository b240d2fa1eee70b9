package service.motion;

import lombok.extern.slf4j.Slf4j;
import model.bo.MotionGeometry;
import model.bo.Trajectory;
import model.entity.Point;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * G-code 指令编码
 * 每行一条控制器指令，";" 之后为注释，控制器会忽略
 */
@Slf4j
@Component
public class GcodeEncoder {

    public static final String UNITS_MM = "G21";
    public static final String RAPID_MOVE = "G0";
    public static final String LINEAR_MOVE = "G1";
    public static final String WAIT_FOR_MOVES = "M400";
    public static final String SET_POSITION = "G92";
    public static final String HOME_ALL = "G28";
    public static final String HOME_XY = "G28 X Y";
    public static final String PAUSE = "PAUSE";

    private final MotionGeometry geometry;

    public GcodeEncoder(MotionGeometry geometry) {
        this.geometry = geometry;
    }

    /**
     * 完整的振荡指令序列
     * G21 -> G0 到中心 -> 每个采样点一条 G1 -> G0 回中心 -> M400 (-> G92 重置坐标)
     */
    public String encode(Trajectory trajectory) {
        Point center = trajectory.getCenter();
        boolean withZ = trajectory.getPattern().usesZAxis();
        int feed = (int) trajectory.getFeedRate();

        List<String> lines = new ArrayList<>(trajectory.size() + 6);
        lines.add(comment(UNITS_MM, "units in millimeters"));
        lines.add(comment(RAPID_MOVE + axes(center, withZ) + " F" + geometry.getTravelFeedRate(), "move to center"));
        for (Point p : trajectory.getPoints()) {
            lines.add(LINEAR_MOVE + axes(p, withZ) + " F" + feed);
        }
        lines.add(comment(RAPID_MOVE + axes(center, withZ) + " F" + geometry.getTravelFeedRate(), "return to center"));
        lines.add(comment(WAIT_FOR_MOVES, "wait until all moves finish"));
        if (trajectory.getPattern().rezeroAfterMotion()) {
            // 采样累积的浮点误差不应挪动逻辑原点
            lines.add(comment(SET_POSITION + axes(center, withZ), "reset position to center"));
        }

        String script = String.join("\n", lines);
        if (log.isDebugEnabled()) {
            log.debug("[{}] 生成的 G-code:\n{}", trajectory.getPattern(), script);
        }
        return script;
    }

    /**
     * 回到固定原点 (ORBITAL 结束后使用)
     */
    public String encodeReturnToOrigin(Point origin) {
        return String.join("\n",
                comment(RAPID_MOVE + axes(origin, false) + " F" + geometry.getTravelFeedRate(), "return to origin"),
                comment(WAIT_FOR_MOVES, "wait until all moves finish"));
    }

    /**
     * 移动到预设目标 z 为 0 时省略 Z 轴
     */
    public String encodeMoveToTarget(Point target) {
        boolean withZ = target.hasZ() && target.getZ() != 0.0;
        return LINEAR_MOVE + axes(target, withZ) + " F" + geometry.getTargetMoveFeedRate();
    }

    public String encodeHomingRecovery() {
        return HOME_XY;
    }

    public String encodeWaitForMoves() {
        return comment(WAIT_FOR_MOVES, "wait for homing");
    }

    public static int countLines(String script) {
        if (script == null || script.isEmpty()) {
            return 0;
        }
        return script.split("\n", -1).length;
    }

    /**
     * 去掉注释后的指令部分
     */
    public static String stripComment(String line) {
        int idx = line.indexOf(';');
        return (idx < 0 ? line : line.substring(0, idx)).trim();
    }

    private static String axes(Point p, boolean withZ) {
        StringBuilder sb = new StringBuilder();
        sb.append(" X").append(format(p.getX()));
        sb.append(" Y").append(format(p.getY()));
        if (withZ && p.hasZ()) {
            sb.append(" Z").append(format(p.getZ()));
        }
        return sb.toString();
    }

    static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static String comment(String command, String text) {
        return command + " ; " + text;
    }
}
