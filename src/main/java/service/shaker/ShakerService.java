package service.shaker;

import com.fasterxml.jackson.databind.JsonNode;
import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import model.bo.DispatchResult;
import model.bo.MotionGeometry;
import model.bo.MotionRequest;
import model.dto.request.MoveTargetReq;
import model.dto.request.OrbitalShakeReq;
import model.dto.request.ShakeReq;
import model.dto.response.ShakeResp;
import model.entity.Point;
import org.springframework.stereotype.Service;
import service.klipper.KlipperApi;
import service.motion.GcodeEncoder;
import service.motion.MotionProfileCalculator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 振荡器对外操作
 * 负责请求校验 调度 以及组装响应
 */
@Slf4j
@Service
public class ShakerService {

    private final ShakerCommandDispatcher dispatcher;
    private final MotionProfileCalculator calculator;
    private final GcodeEncoder encoder;
    private final MotionGeometry geometry;
    private final KlipperApi klipperApi;

    public ShakerService(ShakerCommandDispatcher dispatcher,
                         MotionProfileCalculator calculator,
                         GcodeEncoder encoder,
                         MotionGeometry geometry,
                         KlipperApi klipperApi) {
        this.dispatcher = dispatcher;
        this.calculator = calculator;
        this.encoder = encoder;
        this.geometry = geometry;
        this.klipperApi = klipperApi;
    }

    public ShakeResp runOrbital(OrbitalShakeReq req) {
        MotionRequest motion = MotionRequest.orbital(req.getRpm(), req.getTimeSec(), req.getTarget());
        Point coordinates = calculator.targetCoordinate(motion.getTarget());
        log.info("[ORBITAL] target={}, center=({}, {})", motion.getTarget().getCode(),
                coordinates.getX(), coordinates.getY());

        DispatchResult result = dispatcher.dispatch(motion);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("target", motion.getTarget().getCode());
        parameters.put("rpm", motion.getRpm());
        parameters.put("duration_sec", motion.getTimeSec());
        parameters.put("coordinates", coordinates);

        ShakeResp resp = toResp(result, parameters);
        resp.setHomeResponse(result.getHomeResponse());
        resp.setHomePosition(geometry.origin());
        return resp;
    }

    public ShakeResp runLinear(ShakeReq req) {
        MotionRequest motion = MotionRequest.linear(req.getRpm(), req.getTimeSec());
        DispatchResult result = dispatcher.dispatch(motion);
        return toResp(result, baseParameters(motion));
    }

    public ShakeResp run3d(ShakeReq req) {
        MotionRequest motion = MotionRequest.helical(req.getRpm(), req.getTimeSec());
        DispatchResult result = dispatcher.dispatch(motion);
        Map<String, Object> parameters = baseParameters(motion);
        parameters.putAll(helicalParameters());
        return toResp(result, parameters);
    }

    /**
     * 移动到预设目标位置
     */
    public JsonNode moveToTarget(MoveTargetReq req) {
        if (req == null || req.getTarget() == null) {
            throw new BusinessException(ErrorCodes.TARGET_REQUIRED);
        }
        Point target = calculator.targetCoordinate(req.getTarget());
        String gcode = encoder.encodeMoveToTarget(target);
        log.info("[MOVE] target={}, gcode={}", req.getTarget().getCode(), gcode);
        return dispatcher.sendWithHomingRecovery(gcode, "MOVE");
    }

    /**
     * 各模式固定的几何参数
     */
    public Map<String, Object> describeParameters() {
        Map<String, Object> orbital = new LinkedHashMap<>();
        orbital.put("fixed_radius_mm", geometry.getOrbitalRadius());
        orbital.put("center_xy", new Point(geometry.getCenterX(), geometry.getCenterY()));

        Map<String, Object> linear = new LinkedHashMap<>();
        linear.put("amplitude_y_mm", geometry.getLinearAmplitude());
        linear.put("center_xy", new Point(geometry.getCenterX(), geometry.getCenterY()));

        Map<String, Object> all = new LinkedHashMap<>();
        all.put("orbital", orbital);
        all.put("linear", linear);
        all.put("3d", helicalParameters());
        Map<String, Point> targets = new LinkedHashMap<>();
        geometry.getTargets().forEach((target, point) -> targets.put(target.getCode(), point));
        all.put("targets", targets);
        return all;
    }

    /**
     * 运行前准备：查询控制器信息后全轴归零
     */
    public JsonNode prepare() {
        JsonNode printerData = klipperApi.getPrinterInfo();
        log.info("打印机信息查询完成，开始归零");
        klipperApi.homePrinter();
        log.info("归零完成，可以开始振荡");
        return printerData;
    }

    public JsonNode pause() {
        JsonNode resp = klipperApi.pausePrinter();
        log.info("已发送暂停指令");
        return resp;
    }

    private Map<String, Object> helicalParameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("orbital_radius_mm", geometry.getHelicalRadius());
        params.put("amplitude_z_mm", geometry.getHelicalAmplitudeZ());
        params.put("center_xyz", geometry.center());
        return params;
    }

    private static Map<String, Object> baseParameters(MotionRequest motion) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("rpm", motion.getRpm());
        parameters.put("duration_sec", motion.getTimeSec());
        return parameters;
    }

    private static ShakeResp toResp(DispatchResult result, Map<String, Object> parameters) {
        ShakeResp resp = new ShakeResp();
        resp.setParameters(parameters);
        resp.setGcodeLines(result.getGcodeLines());
        resp.setMoonrakerResponse(result.getMoonrakerResponse());
        return resp;
    }
}
