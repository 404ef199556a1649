package com.company.signals.domain;

import com.company.signals.domain.enums.Confidence;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Suggestion {
    private String action;
    private String description;
    private Confidence confidence;
    private String command;

    public static Suggestion of(String action, String description, Confidence confidence) {
        return new Suggestion(action, description, confidence, null);
    }

    public Suggestion copy() {
        return new Suggestion(action, description, confidence, command);
    }
}
