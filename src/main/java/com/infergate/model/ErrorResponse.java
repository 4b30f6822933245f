package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Uniform error envelope: {@code {"error": {"message", "type", "code"}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    public static final String TYPE_API_ERROR = "api_error";

    @JsonProperty("error")
    private ErrorDetail error;

    public static ErrorResponse of(String message, int code) {
        return new ErrorResponse(new ErrorDetail(message, TYPE_API_ERROR, code));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorDetail {

        @JsonProperty("message")
        private String message;

        @JsonProperty("type")
        private String type;

        @JsonProperty("code")
        private int code;
    }
}
