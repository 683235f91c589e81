package com.example.ample.common.exception;

public class ScrobblerException extends RuntimeException {

    private final ErrorKind kind;
    private final String code;
    private final String userAction;

    public ScrobblerException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null, null);
    }

    public ScrobblerException(ErrorKind kind, String code, String message, Throwable cause) {
        this(kind, code, message, null, cause);
    }

    public ScrobblerException(ErrorKind kind, String code, String message, String userAction, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
        this.userAction = userAction;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }

    public boolean isRetryable() {
        return kind == ErrorKind.RETRYABLE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(code).append(": ").append(getMessage());
        if (userAction != null) {
            sb.append(" (").append(userAction).append(')');
        }
        return sb.toString();
    }
}
