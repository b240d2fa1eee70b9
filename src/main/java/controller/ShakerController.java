package controller;

import com.fasterxml.jackson.databind.JsonNode;
import common.Result;
import model.dto.request.MoveTargetReq;
import model.dto.request.OrbitalShakeReq;
import model.dto.request.ShakeReq;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;
import service.shaker.ShakerService;

/**
 * 振荡器控制
 */
@RestController
@RequestMapping("/shaker")
public class ShakerController {

    private final ShakerService shakerService;

    @Autowired
    public ShakerController(ShakerService shakerService) {
        this.shakerService = shakerService;
    }

    // 轨道模式 在 target_A / target_B 位置做圆周振荡 结束后回原点
    @PostMapping("/orbital")
    public Result orbital(@RequestBody OrbitalShakeReq req) {
        return Result.success("轨道模式执行完成", shakerService.runOrbital(req));
    }

    // 直线模式 沿 Y 轴往复
    @PostMapping("/linear")
    public Result linear(@RequestBody ShakeReq req) {
        return Result.success("直线模式执行完成", shakerService.runLinear(req));
    }

    // 3D 模式 XY 圆周 + Z 轴正弦摆动
    @PostMapping("/3d")
    public Result threeD(@RequestBody ShakeReq req) {
        return Result.success("3D 模式执行完成", shakerService.run3d(req));
    }

    @PostMapping("/move")
    public Result move(@RequestBody MoveTargetReq req) {
        JsonNode resp = shakerService.moveToTarget(req);
        return Result.success("已移动到 " + req.getTarget().getCode(), resp);
    }

    @GetMapping("/parameters")
    public Result parameters() {
        return Result.success(shakerService.describeParameters());
    }
}
