package model.bo;

import common.consts.ErrorCodes;
import common.consts.MotionPatternEnum;
import common.consts.VialTargetEnum;
import common.exception.BusinessException;
import lombok.Value;

/**
 * 一次振荡运动请求
 * 构造时校验 rpm > 0, timeSec > 0, ORBITAL 必须指定目标
 */
@Value
public class MotionRequest {
    MotionPatternEnum pattern;
    int rpm;
    double timeSec;
    VialTargetEnum target;

    private MotionRequest(MotionPatternEnum pattern, int rpm, double timeSec, VialTargetEnum target) {
        this.pattern = pattern;
        this.rpm = rpm;
        this.timeSec = timeSec;
        this.target = target;
    }

    public static MotionRequest orbital(Integer rpm, Double timeSec, VialTargetEnum target) {
        if (target == null) {
            throw new BusinessException(ErrorCodes.TARGET_REQUIRED);
        }
        return of(MotionPatternEnum.ORBITAL, rpm, timeSec, target);
    }

    public static MotionRequest linear(Integer rpm, Double timeSec) {
        return of(MotionPatternEnum.LINEAR, rpm, timeSec, null);
    }

    public static MotionRequest helical(Integer rpm, Double timeSec) {
        return of(MotionPatternEnum.HELICAL_3D, rpm, timeSec, null);
    }

    private static MotionRequest of(MotionPatternEnum pattern, Integer rpm, Double timeSec, VialTargetEnum target) {
        if (rpm == null || rpm <= 0) {
            throw new BusinessException(ErrorCodes.INVALID_RPM);
        }
        // NaN 也会在这里被拒绝
        if (timeSec == null || !(timeSec > 0) || timeSec.isInfinite()) {
            throw new BusinessException(ErrorCodes.INVALID_DURATION);
        }
        return new MotionRequest(pattern, rpm, timeSec, target);
    }
}
