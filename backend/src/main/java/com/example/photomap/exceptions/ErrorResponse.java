package com.example.photomap.exceptions;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(int status, @JsonProperty("error") String error, String message) {
    @JsonProperty("type")
    public String type() {
        return error;
    }

    public static ErrorResponse of(PhotoMapException ex) {
        return new ErrorResponse(ex.getError().getStatus().value(), ex.getError().name(), ex.getMessage());
    }
}
