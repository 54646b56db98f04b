package io.cronops.core.api;

public record ApiResponse(int status, Object data) {
    public static ApiResponse ok(Object data) {
        return new ApiResponse(200, data);
    }

    public static ApiResponse created(Object data) {
        return new ApiResponse(201, data);
    }

    public static ApiResponse accepted(Object data) {
        return new ApiResponse(202, data);
    }
}
