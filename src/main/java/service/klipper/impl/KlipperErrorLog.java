package service.klipper.impl;

import common.exception.KlipperException;
import lombok.Data;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 控制器错误日志服务
 * 记录最近的通信失败和自动归零恢复，供运维查询
 */
@Component
public class KlipperErrorLog {

    private static final int DEFAULT_CAPACITY = 500;

    private final Deque<ErrorLogEntry> errorBuffer = new ArrayDeque<>(DEFAULT_CAPACITY);

    /**
     * 记录抛给调用方的控制器异常
     */
    public synchronized void recordFailure(String operation, KlipperException e) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.FAILURE);
        entry.setOperation(operation);
        entry.setErrorCode(e.getErrorCode());
        entry.setHttpStatus(e.getHttpStatus());
        entry.setMessage(e.getMessage());
        entry.setDetail(e.getDetail());
        entry.setTimestamp(LocalDateTime.now());

        addEntry(entry);
    }

    /**
     * 记录非控制器的内部异常 只保留类型和消息
     */
    public synchronized void recordInternalError(String operation, Throwable cause) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.INTERNAL);
        entry.setOperation(operation);
        entry.setHttpStatus(500);
        entry.setMessage(cause.getClass().getSimpleName());
        entry.setDetail(cause.getMessage());
        entry.setTimestamp(LocalDateTime.now());

        addEntry(entry);
    }

    /**
     * 记录一次自动归零恢复 (recovered 表示重发是否成功)
     */
    public synchronized void recordHomingRecovery(String operation, KlipperException e, boolean recovered) {
        ErrorLogEntry entry = new ErrorLogEntry();
        entry.setErrorType(ErrorType.HOMING_RECOVERY);
        entry.setOperation(operation);
        entry.setErrorCode(e.getErrorCode());
        entry.setHttpStatus(e.getHttpStatus());
        entry.setMessage(e.getMessage());
        entry.setDetail(e.getDetail());
        entry.setRecovered(recovered);
        entry.setTimestamp(LocalDateTime.now());

        addEntry(entry);
    }

    private void addEntry(ErrorLogEntry entry) {
        if (errorBuffer.size() >= DEFAULT_CAPACITY) {
            errorBuffer.removeFirst();
        }
        errorBuffer.addLast(entry);
    }

    /**
     * 查询最近 limit 条 (按时间先后)
     */
    public synchronized List<ErrorLogEntry> listRecent(int limit) {
        List<ErrorLogEntry> all = new ArrayList<>(errorBuffer);
        int from = Math.max(0, all.size() - Math.max(limit, 0));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    /**
     * 查询所有错误日志
     */
    public synchronized List<ErrorLogEntry> listAll() {
        return new ArrayList<>(errorBuffer);
    }

    public synchronized void clear() {
        errorBuffer.clear();
    }

    /**
     * 错误类型
     */
    public enum ErrorType {
        FAILURE,          // 抛给调用方的控制器错误
        INTERNAL,         // 内部错误
        HOMING_RECOVERY   // 自动归零后重发
    }

    /**
     * 错误日志条目
     */
    @Data
    public static class ErrorLogEntry {
        private ErrorType errorType;
        private String operation;
        private String errorCode;
        private Integer httpStatus;
        private String message;
        private String detail;
        private Boolean recovered;
        private LocalDateTime timestamp;
    }
}
