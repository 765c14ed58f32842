package com.example.bully.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteResponse {
    private String result;
    private ErrorCode error;
    private String message;

    public static ExecuteResponse ok(String result) {
        return new ExecuteResponse(result, null, null);
    }

    public static ExecuteResponse failure(ErrorCode error, String message) {
        return new ExecuteResponse(null, error, message);
    }

    public boolean succeeded() {
        return error == null;
    }
}
