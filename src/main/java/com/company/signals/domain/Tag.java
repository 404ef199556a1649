package com.company.signals.domain;

import lombok.Value;

@Value
public class Tag {
    String key;
    String value;
}
