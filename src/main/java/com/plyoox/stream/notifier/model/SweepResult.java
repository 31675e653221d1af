package com.plyoox.stream.notifier.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SweepResult {
    int checked;
    int deleted;
    int failed;
    int missingRemotely;

    public static SweepResult skipped() {
        return SweepResult.builder().build();
    }
}
