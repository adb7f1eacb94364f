package com.landregistry.certificates;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a public certificate check. Failures are reported here instead of thrown.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResult {

    boolean valid;

    Reason reason;

    public static VerificationResult valid() {
        return new VerificationResult(true, null);
    }

    public static VerificationResult invalid(Reason reason) {
        return new VerificationResult(false, reason);
    }

    public enum Reason {
        NOT_FOUND,
        NOT_ACTIVE,
        HASH_MISMATCH;

        @JsonValue
        public String code() {
            return name().toLowerCase();
        }
    }
}
