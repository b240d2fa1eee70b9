package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import service.klipper.impl.KlipperErrorLog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器
 * 捕获所有异常，记录日志，并以统一的 Result 返回
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final KlipperErrorLog errorLog;

    public GlobalExceptionHandler(KlipperErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    /**
     * 处理业务异常 (参数校验等)
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Result> handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(Result.error(400, e.getMessage(), errorDetail(ErrorCodes.VALIDATION_ERROR, e.getMessage())));
    }

    /**
     * 请求体无法解析 (JSON 格式错误, 未知的 target 等)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("请求体解析失败: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(Result.error(400, "输入数据无效",
                        errorDetail(ErrorCodes.VALIDATION_ERROR, e.getMostSpecificCause().getMessage())));
    }

    /**
     * 处理控制器通信异常 连接错误为 503 控制器错误保留其状态码
     */
    @ExceptionHandler(KlipperException.class)
    public ResponseEntity<Result> handleKlipperException(KlipperException e, HttpServletRequest request) {
        log.error("Klipper 异常: {} - {} ({})", e.getErrorCode(), e.getMessage(), e.getDetail());
        errorLog.recordFailure(request.getRequestURI(), e);
        return ResponseEntity.status(e.getHttpStatus())
                .body(Result.error(e.getHttpStatus(), e.getMessage(), errorDetail(e.getErrorCode(), e.getDetail())));
    }

    /**
     * 处理所有其他异常 只返回异常类型和消息
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result> handleException(Exception e, HttpServletRequest request) {
        log.error("系统异常", e);
        errorLog.recordInternalError(request.getRequestURI(), e);
        return ResponseEntity.internalServerError()
                .body(Result.error(500, ErrorCodes.SYSTEM_ERROR, errorDetail(ErrorCodes.INTERNAL_SERVER_ERROR,
                        e.getClass().getSimpleName() + ": " + e.getMessage())));
    }

    private static Map<String, Object> errorDetail(String code, String detail) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("detail", detail);
        return error;
    }
}
