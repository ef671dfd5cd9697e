package com.tripscout.pojo.research;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一次进度回调的内容。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResearchProgress {

    private String jobId;

    private String step;

    private String message;

    private int completedSteps;

    private int totalSteps;

    private int percentage;

    public static ResearchProgress of(String jobId, String step, String message, int completedSteps, int totalSteps) {
        return new ResearchProgress(jobId, step, message, completedSteps, totalSteps,
                percentageOf(completedSteps, totalSteps));
    }

    public static int percentageOf(int completedSteps, int totalSteps) {
        if (totalSteps <= 0) {
            return 0;
        }
        return Math.min(100, (int) Math.floor(100.0 * completedSteps / totalSteps));
    }
}
