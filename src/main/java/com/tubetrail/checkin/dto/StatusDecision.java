package com.tubetrail.checkin.dto;

import com.tubetrail.checkin.entity.PendingReason;
import com.tubetrail.checkin.entity.VerificationMethod;
import com.tubetrail.checkin.entity.VisitStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * (status, pendingReason, verificationMethod) triple produced by StatusDecisionEngine.
 * pendingReason is null exactly when status is VERIFIED.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StatusDecision {

    VisitStatus status;

    PendingReason pendingReason;

    VerificationMethod verificationMethod;

    public static StatusDecision verified(VerificationMethod method) {
        return new StatusDecision(VisitStatus.VERIFIED, null, method);
    }

    public static StatusDecision pending(PendingReason reason, VerificationMethod method) {
        return new StatusDecision(VisitStatus.PENDING, reason, method);
    }
}
