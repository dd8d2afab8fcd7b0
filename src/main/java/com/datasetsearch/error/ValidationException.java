package com.datasetsearch.error;

public class ValidationException extends DatasetSearchException {
    private final String parameter;

    public ValidationException(String parameter, String message) {
        super(ErrorCode.BAD_REQUEST, "参数 " + parameter + " 非法: " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
