package com.landregistry.api.dto;

import lombok.Data;

/**
 * Public verification request. Not validated: an unknown or malformed certificate is
 * reported in the verification result.
 */
@Data
public class VerifyCertificateRequest {

    private String certificateNumber;

    private String hash;
}
