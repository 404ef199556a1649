package com.company.signals.domain;

import lombok.Value;

@Value
public class Breadcrumb {
    String timestamp;
    String category;
    String message;
}
