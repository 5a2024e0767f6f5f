package com.copyleft.Coup.domain.view;

import com.copyleft.Coup.domain.pending.Responders;
import com.copyleft.Coup.domain.type.ActionKind;
import com.copyleft.Coup.domain.type.LossReason;
import com.copyleft.Coup.domain.type.ResponderStatus;
import com.copyleft.Coup.domain.type.Role;
import com.copyleft.Coup.domain.type.Stage;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PendingActionView {

    private ActionKind type;
    private Stage stage;

    private String actorId;
    private String targetId;
    private Role claimedRole;

    private String blockedBy;
    private Role blockRole;

    private Map<String, ResponderStatus> responders;

    // 영향력 상실 단계
    private String playerId;
    private LossReason reason;

    // 교환 선택 단계
    private Integer keepCount;

    public static PendingActionView claim(ActionKind type, Stage stage, String actorId, String targetId,
                                          Role claimedRole, Responders responders) {
        return PendingActionView.builder()
                .type(type).stage(stage)
                .actorId(actorId)
                .targetId(targetId)
                .claimedRole(claimedRole)
                .responders(responders.snapshot())
                .build();
    }

    public static PendingActionView block(ActionKind type, Stage stage, String actorId, String targetId,
                                          Role claimedRole, String blockedBy, Role blockRole, Responders responders) {
        return PendingActionView.builder()
                .type(type).stage(stage)
                .actorId(actorId)
                .targetId(targetId)
                .claimedRole(claimedRole)
                .blockedBy(blockedBy)
                .blockRole(blockRole)
                .responders(responders.snapshot())
                .build();
    }
}
