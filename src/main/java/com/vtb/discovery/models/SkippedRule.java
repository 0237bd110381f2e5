package com.vtb.discovery.models;

import lombok.Value;

@Value
public class SkippedRule {
    String ruleId;
    ComplianceFramework framework;
    String reason;
}
