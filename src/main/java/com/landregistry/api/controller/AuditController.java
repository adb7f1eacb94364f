package com.landregistry.api.controller;

import com.landregistry.audit.AuditEvent;
import com.landregistry.audit.AuditRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Read-only audit history")
public class AuditController {

    private final AuditRecorder auditRecorder;

    @GetMapping("/{resourceType}/{resourceId}")
    @Operation(summary = "Audit history of one resource, newest first")
    public ResponseEntity<List<AuditEvent>> getHistory(@PathVariable String resourceType,
                                                       @PathVariable String resourceId) {
        return ResponseEntity.ok(auditRecorder.getHistory(resourceType, resourceId));
    }
}
