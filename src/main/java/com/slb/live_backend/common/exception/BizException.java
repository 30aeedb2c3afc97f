package com.slb.live_backend.common.exception;

public class BizException extends RuntimeException{

    private static final long serialVersionUID = 1L;

    // 业务错误码，默认与 HTTP 状态码对齐
    private final int code;

    public BizException(String message) {
        super(message);
        this.code = 400; // 默认400 - 参数或业务校验失败
    }

    public BizException(int code, String message) {
        super(message);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
