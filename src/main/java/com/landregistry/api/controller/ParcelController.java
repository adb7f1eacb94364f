package com.landregistry.api.controller;

import com.landregistry.api.dto.CreateParcelRequest;
import com.landregistry.parcels.CreateParcelCommand;
import com.landregistry.parcels.Parcel;
import com.landregistry.parcels.ParcelService;
import com.landregistry.parcels.ParcelStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the parcel registry.
 */
@RestController
@RequestMapping("/api/v1/parcels")
@RequiredArgsConstructor
@Tag(name = "Parcels", description = "Land parcel registry API")
public class ParcelController {

    private final ParcelService parcelService;

    @PostMapping
    @Operation(summary = "Register a new land parcel")
    public ResponseEntity<Parcel> createParcel(@Valid @RequestBody CreateParcelRequest request) {
        CreateParcelCommand command = CreateParcelCommand.builder()
            .parcelNumber(request.getParcelNumber())
            .location(request.getLocation())
            .area(request.getArea())
            .landType(request.getLandType())
            .marketValue(request.getMarketValue())
            .district(request.getDistrict())
            .village(request.getVillage())
            .build();
        Parcel parcel = parcelService.createParcel(command, request.getOperatorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(parcel);
    }

    @GetMapping("/{parcelId}")
    @Operation(summary = "Get parcel details")
    public ResponseEntity<Parcel> getParcel(@PathVariable String parcelId) {
        return ResponseEntity.ok(parcelService.getParcel(parcelId));
    }

    @GetMapping("/number/{parcelNumber}")
    @Operation(summary = "Get a parcel by its parcel number")
    public ResponseEntity<Parcel> getParcelByNumber(@PathVariable String parcelNumber) {
        return ResponseEntity.ok(parcelService.getParcelByNumber(parcelNumber));
    }

    @GetMapping("/stats")
    @Operation(summary = "Parcel counts by status and area totals")
    public ResponseEntity<ParcelStats> getParcelStats() {
        return ResponseEntity.ok(parcelService.getParcelStats());
    }
}
