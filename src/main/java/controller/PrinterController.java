package controller;

import common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import service.klipper.impl.KlipperErrorLog;
import service.shaker.ShakerService;

import java.util.Collections;

@RestController
@RequestMapping("/printer")
@Slf4j
public class PrinterController {

    @Autowired
    private ShakerService shakerService;

    @Autowired
    private KlipperErrorLog errorLog;

    /**
     * 运行准备 查询控制器信息并全轴归零
     */
    @GetMapping("/run")
    public Result run() {
        return Result.success("振荡器准备完成", Collections.singletonMap("printer_data", shakerService.prepare()));
    }

    @PostMapping("/pause")
    public Result pause() {
        shakerService.pause();
        return Result.success("已暂停", null);
    }

    /**
     * 最近的控制器错误
     */
    @GetMapping("/errors")
    public Result errors(@RequestParam(defaultValue = "50") int limit) {
        return Result.success(errorLog.listRecent(limit));
    }
}
