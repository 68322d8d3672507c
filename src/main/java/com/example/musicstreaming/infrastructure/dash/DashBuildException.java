package com.example.musicstreaming.infrastructure.dash;

public class DashBuildException extends RuntimeException {

    public DashBuildException(String message) {
        super(message);
    }

    public DashBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
