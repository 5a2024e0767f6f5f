package com.copyleft.Coup.domain.view;

import com.copyleft.Coup.domain.type.Role;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 보는 사람 기준의 카드 표현. 볼 수 없는 카드는 역할 정보가 아예 없는 Hidden이 된다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CardView.Visible.class, name = "visible"),
        @JsonSubTypes.Type(value = CardView.Hidden.class, name = "hidden")
})
public sealed interface CardView {

    boolean revealed();

    record Visible(Role role, boolean revealed) implements CardView {}

    record Hidden() implements CardView {
        @JsonProperty
        public boolean revealed() {
            return false;
        }
    }
}
