package com.tripscout.common.exception;

import com.tripscout.common.result.ErrorCode;

/**
 * 统一的业务异常类型，由全局异常处理器转换为友好的错误响应。
 * <p>用于表示“任务不存在 / 任务未完成”等预期内错误，而不是系统级故障。</p>
 */
public class BaseException extends RuntimeException {

    /**
     * 业务错误码；为空时由上层使用通用错误码兜底。
     */
    private final Integer code;

    public BaseException(String message) {
        super(message);
        this.code = ErrorCode.COMMON_ERROR.getCode();
    }

    public BaseException(ErrorCode errorCode) {
        super(errorCode.getMsg());
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.code = errorCode.getCode();
    }

    public BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.code = errorCode.getCode();
    }

    public Integer getCode() {
        return code;
    }
}
