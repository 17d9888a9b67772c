package com.HRPayMaster.hr_backend.exception;

import org.springframework.http.HttpStatus;

public class AuthorizationException extends ApiException {
    public AuthorizationException(String message) {
        super(message, HttpStatus.FORBIDDEN, "APPROVER_NOT_AUTHORIZED");
    }
}
