package com.jay.insight.model;

import com.jay.insight.model.enums.Severity;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class RedFlag {
    private String id;
    private Severity severity;
    private String title;
    private String description;
    private List<String> relatedMetrics;
}
