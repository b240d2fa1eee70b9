package model.entity;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 控制器工作坐标系中的一个点 (单位：毫米)
 * z 为 null 表示该点只有 X/Y 两轴
 */
@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Point {
    double x;
    double y;
    Double z;

    public Point(double x, double y) {
        this(x, y, null);
    }

    public boolean hasZ() {
        return z != null;
    }
}
