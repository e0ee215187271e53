package org.aviator.service.crash;

import lombok.Getter;

@Getter
public class CrashException extends RuntimeException {
    private final RejectionReason reason;

    public CrashException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CrashException(RejectionReason reason) {
        this(reason, reason.name());
    }
}
