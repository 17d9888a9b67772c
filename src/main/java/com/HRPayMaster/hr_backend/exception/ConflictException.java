package com.HRPayMaster.hr_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * The request collides with an existing record. {@code conflictingId} identifies that record
 * when one exists.
 */
@Getter
public class ConflictException extends ApiException {
    private final String conflictingResource;
    private final Object conflictingId;

    public ConflictException(String message) {
        this(message, null, null);
    }

    public ConflictException(String message, String conflictingResource, Object conflictingId) {
        super(message, HttpStatus.CONFLICT, "CONFLICT");
        this.conflictingResource = conflictingResource;
        this.conflictingId = conflictingId;
    }
}
