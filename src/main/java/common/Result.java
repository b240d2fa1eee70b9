package common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 统一响应体
 * 成功时 data 为控制器返回的内容, 失败时 data 为 {code, detail} 错误详情
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Result {
    private Integer code; // 200 成功, 失败时与 HTTP 状态码一致
    private String msg;
    private Object data;

    public static Result success(Object data) {
        return success("操作成功", data);
    }

    public static Result success(String msg, Object data) {
        return new Result(200, msg, data);
    }

    // 失败 (status 与响应的 HTTP 状态码相同)
    public static Result error(int status, String msg, Object detail) {
        return new Result(status, msg, detail);
    }
}
