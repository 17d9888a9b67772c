package com.HRPayMaster.hr_backend.exception;

import org.springframework.http.HttpStatus;

public class ComputationException extends ApiException {
    public ComputationException(String message) {
        super(message, HttpStatus.UNPROCESSABLE_ENTITY, "COMPUTATION_ERROR");
    }

    protected ComputationException(String message, String errorCode) {
        super(message, HttpStatus.UNPROCESSABLE_ENTITY, errorCode);
    }
}
