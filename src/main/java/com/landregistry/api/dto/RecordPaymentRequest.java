package com.landregistry.api.dto;

import com.landregistry.applications.PaymentStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for recording the outcome of a fee payment.
 */
@Data
public class RecordPaymentRequest {

    @NotNull(message = "Payment status is required")
    private PaymentStatus paymentStatus;

    @Size(max = 255, message = "Payment reference must be at most 255 characters")
    private String paymentReference;

    @NotBlank(message = "Actor ID is required")
    @Size(max = 255, message = "Actor ID must be at most 255 characters")
    private String actorId;
}
