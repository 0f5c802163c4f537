package com.jay.insight.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class LifecycleInfo {
    private String stage;
    private String description;
    private LocalDate classifiedAt;
}
