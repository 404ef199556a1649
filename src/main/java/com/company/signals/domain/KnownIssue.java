package com.company.signals.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KnownIssue {
    private String id;
    private String title;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String description;
    private String fix;
    private boolean fixed;
}
