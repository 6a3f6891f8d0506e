package it.unimib.datai.faaslocal.common.model;

import java.util.Map;

/**
 * Response posted back by a function process, handed to the caller still waiting on the invocation.
 */
public record InvocationResponse(
        int statusCode,
        Map<String, String> headers,
        Object body,
        ErrorInfo error
) {
    public InvocationResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static InvocationResponse ok(Object body) {
        return new InvocationResponse(200, Map.of(), body, null);
    }

    public static InvocationResponse error(int statusCode, String code, String message) {
        return new InvocationResponse(statusCode, Map.of(), null, new ErrorInfo(code, message));
    }

    public boolean success() {
        return error == null && statusCode < 400;
    }
}
