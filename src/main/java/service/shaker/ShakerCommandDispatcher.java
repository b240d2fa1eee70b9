package service.shaker;

import com.fasterxml.jackson.databind.JsonNode;
import common.consts.MotionPatternEnum;
import common.exception.HomingRequiredException;
import common.exception.KlipperException;
import lombok.extern.slf4j.Slf4j;
import model.bo.DispatchResult;
import model.bo.MotionGeometry;
import model.bo.MotionRequest;
import model.bo.Trajectory;
import org.springframework.stereotype.Service;
import service.klipper.KlipperApi;
import service.klipper.impl.KlipperErrorLog;
import service.motion.GcodeEncoder;
import service.motion.MotionProfileCalculator;

/**
 * 指令调度
 * 计算轨迹 -> 编码 -> 下发，遇到 "Must home axis first" 时自动归零并重发一次
 *
 * 每次调用严格顺序执行，不同请求之间不共享可变状态
 */
@Slf4j
@Service
public class ShakerCommandDispatcher {

    private final KlipperApi klipperApi;
    private final MotionProfileCalculator calculator;
    private final GcodeEncoder encoder;
    private final MotionGeometry geometry;
    private final KlipperErrorLog errorLog;

    public ShakerCommandDispatcher(KlipperApi klipperApi,
                                   MotionProfileCalculator calculator,
                                   GcodeEncoder encoder,
                                   MotionGeometry geometry,
                                   KlipperErrorLog errorLog) {
        this.klipperApi = klipperApi;
        this.calculator = calculator;
        this.encoder = encoder;
        this.geometry = geometry;
        this.errorLog = errorLog;
    }

    public DispatchResult dispatch(MotionRequest req) {
        Trajectory trajectory = calculator.calculate(req);
        String script = encoder.encode(trajectory);
        String label = req.getPattern().name();

        JsonNode moonrakerResponse = sendWithHomingRecovery(script, label);

        JsonNode homeResponse = null;
        if (req.getPattern() == MotionPatternEnum.ORBITAL) {
            // 不同目标出发的 ORBITAL 最终都回到同一个原点
            log.info("[{}] 返回原点 ({}, {})", label, geometry.getOriginX(), geometry.getOriginY());
            homeResponse = sendWithHomingRecovery(encoder.encodeReturnToOrigin(geometry.origin()), label + "/origin");
        }

        return new DispatchResult(req, trajectory, script, GcodeEncoder.countLines(script),
                moonrakerResponse, homeResponse);
    }

    /**
     * 下发脚本；若控制器要求先归零，则 G28 X Y -> M400 -> 原脚本重发一次
     * 重发仍失败或其他任何错误都原样抛出
     */
    public JsonNode sendWithHomingRecovery(String script, String label) {
        try {
            return klipperApi.sendGcode(script);
        } catch (HomingRequiredException e) {
            log.warn("[{}] 需要先归零，执行归零后重试: {}", label, e.getResponseText());
            klipperApi.sendGcode(encoder.encodeHomingRecovery());
            klipperApi.sendGcode(encoder.encodeWaitForMoves());
            log.info("[{}] 归零完成，重新发送 G-code", label);
            try {
                JsonNode response = klipperApi.sendGcode(script);
                errorLog.recordHomingRecovery(label, e, true);
                return response;
            } catch (KlipperException retryFailure) {
                errorLog.recordHomingRecovery(label, e, false);
                throw retryFailure;
            }
        }
    }
}
