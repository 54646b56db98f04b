package io.cronops.core.api;

@FunctionalInterface
interface ApiHandler {
    ApiResponse handle(ApiRequest request) throws Exception;
}
