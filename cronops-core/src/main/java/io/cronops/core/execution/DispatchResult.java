package io.cronops.core.execution;

public record DispatchResult(ExecutionStatus status, Integer statusCode, String response, String error) {
    public DispatchResult {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("dispatch result must be terminal");
        }
    }

    public static DispatchResult success(Integer statusCode, String response) {
        return new DispatchResult(ExecutionStatus.SUCCESS, statusCode, response, null);
    }

    public static DispatchResult failed(Integer statusCode, String response, String error) {
        return new DispatchResult(ExecutionStatus.FAILED, statusCode, response, error);
    }

    public static DispatchResult timeout(String error) {
        return new DispatchResult(ExecutionStatus.TIMEOUT, null, null, error);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }
}
