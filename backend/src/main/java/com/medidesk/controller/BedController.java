package com.medidesk.controller;

import com.medidesk.dto.BedDTO;
import com.medidesk.entity.Bed;
import com.medidesk.service.BedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/beds")
@RequiredArgsConstructor
@Tag(name = "Beds", description = "Bed inventory, maintenance and occupancy")
public class BedController {

    private final BedService bedService;

    @PostMapping
    @Operation(summary = "Add a bed")
    public ResponseEntity<BedDTO.Response> createBed(@Valid @RequestBody BedDTO.CreateRequest request) {
        Bed bed = bedService.createBed(request.getBedNumber(), request.getWardType(), request.getPerDayCharge());
        return ResponseEntity.ok(mapToResponse(bed));
    }

    @GetMapping("/{bedId}")
    @Operation(summary = "Get bed by ID")
    public ResponseEntity<BedDTO.Response> getBed(@PathVariable String bedId) {
        return ResponseEntity.ok(mapToResponse(bedService.getBed(bedId)));
    }

    @GetMapping("/available")
    @Operation(summary = "Available beds, optionally for one ward type")
    public ResponseEntity<List<BedDTO.Response>> availableBeds(@RequestParam(required = false) Bed.WardType wardType) {
        return ResponseEntity.ok(bedService.findAvailableBeds(wardType).stream().map(this::mapToResponse).toList());
    }

    @GetMapping("/ward/{wardType}")
    @Operation(summary = "All beds of a ward type")
    public ResponseEntity<List<BedDTO.Response>> bedsByWard(@PathVariable Bed.WardType wardType) {
        return ResponseEntity.ok(bedService.findBedsByWard(wardType).stream().map(this::mapToResponse).toList());
    }

    @GetMapping("/occupancy")
    @Operation(summary = "Occupancy statistics")
    public ResponseEntity<BedDTO.OccupancyStats> occupancy() {
        return ResponseEntity.ok(bedService.getOccupancyStats());
    }

    @PostMapping("/{bedId}/maintenance")
    @Operation(summary = "Take an available bed out of service")
    public ResponseEntity<BedDTO.Response> markUnderMaintenance(@PathVariable String bedId) {
        return ResponseEntity.ok(mapToResponse(bedService.markUnderMaintenance(bedId)));
    }

    @DeleteMapping("/{bedId}/maintenance")
    @Operation(summary = "Return a bed from maintenance")
    public ResponseEntity<BedDTO.Response> releaseFromMaintenance(@PathVariable String bedId) {
        return ResponseEntity.ok(mapToResponse(bedService.releaseFromMaintenance(bedId)));
    }

    @PutMapping("/{bedId}/rate")
    @Operation(summary = "Change the per-day charge (audited)")
    public ResponseEntity<BedDTO.Response> updateRate(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String bedId,
            @Valid @RequestBody BedDTO.RateUpdateRequest request) {
        return ResponseEntity.ok(mapToResponse(
            bedService.updatePerDayCharge(bedId, request.getPerDayCharge(), Actors.of(jwt))));
    }

    private BedDTO.Response mapToResponse(Bed bed) {
        return BedDTO.Response.builder()
            .id(bed.getId())
            .bedNumber(bed.getBedNumber())
            .wardType(bed.getWardType())
            .perDayCharge(bed.getPerDayCharge())
            .status(bed.getStatus())
            .build();
    }
}
