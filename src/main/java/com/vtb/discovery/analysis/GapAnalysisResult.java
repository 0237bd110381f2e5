package com.vtb.discovery.analysis;

import com.vtb.discovery.models.Gap;
import com.vtb.discovery.models.GapType;
import com.vtb.discovery.models.RunIssue;
import com.vtb.discovery.models.SkippedRule;
import lombok.Value;

import java.util.List;

@Value
public class GapAnalysisResult {
    List<Gap> gaps;
    List<RunIssue> issues;
    List<SkippedRule> skippedRules;

    public long count(GapType type) {
        return gaps.stream().filter(gap -> gap.getGapType() == type).count();
    }
}
