package com.example.musicstreaming.common.exception;

public class BusinessException extends RuntimeException {

    private final String code;
    private final String userAction;
    private final int statusCode;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        this(code, message, userAction, 400);
    }

    public BusinessException(String code, String message, String userAction, int statusCode) {
        super(message);
        this.code = code;
        this.userAction = userAction;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }

    /**
     * HTTP status the web layer should answer with.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
