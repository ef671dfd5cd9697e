package com.tripscout.common.exception;

import com.tripscout.common.result.ErrorCode;

/**
 * 调研任务级别的失败（例如结果汇总阶段出错）。
 * 任务已被标记为 failed 之后才会抛给调用方。
 */
public class ResearchException extends BaseException {

    public ResearchException(String message, Throwable cause) {
        super(ErrorCode.RESEARCH_FAILED, message, cause);
    }

    public ResearchException(String message) {
        super(ErrorCode.RESEARCH_FAILED, message);
    }
}
