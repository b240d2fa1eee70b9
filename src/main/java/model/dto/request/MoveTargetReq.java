package model.dto.request;

import common.consts.VialTargetEnum;
import lombok.Data;

@Data
public class MoveTargetReq {
    private VialTargetEnum target;
}
