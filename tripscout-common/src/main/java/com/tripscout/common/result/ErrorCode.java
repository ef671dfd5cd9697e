package com.tripscout.common.result;

/**
 * 错误码枚举。
 * <p>1xxx 为请求参数类错误，2xxx 为调研任务相关错误。</p>
 */
public enum ErrorCode {

    SUCCESS(0, "ok"),

    /** 通用业务错误（未细分场景时的兜底） */
    COMMON_ERROR(1, "error"),

    /** 出行偏好不合法 */
    INVALID_PREFERENCES(1001, "出行偏好参数不合法"),

    /** 请求过于频繁 */
    RATE_LIMITED(1002, "请求过于频繁，请稍后再试"),

    /** 调研任务不存在 */
    JOB_NOT_FOUND(2001, "调研任务不存在"),

    /** 调研任务尚未完成 */
    JOB_NOT_COMPLETED(2002, "调研任务尚未完成"),

    /** 任务已完成但没有结果 */
    JOB_RESULTS_MISSING(2003, "调研任务没有可用结果"),

    /** 结果 JSON 无法解析 */
    JOB_RESULTS_CORRUPTED(2004, "调研结果解析失败"),

    /** 调研任务执行失败 */
    RESEARCH_FAILED(2005, "调研任务执行失败"),

    /** 同步调研超时 */
    RESEARCH_TIMEOUT(2006, "调研超时，请改用异步任务");

    private final int code;
    private final String msg;

    ErrorCode(int code, String msg) {
        this.code = code;
        this.msg = msg;
    }

    public int getCode() {
        return code;
    }

    public String getMsg() {
        return msg;
    }
}
