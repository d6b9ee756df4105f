package com.dinebooking.allocation.api.controller;

import com.dinebooking.allocation.api.dto.CreateReservationRequest;
import com.dinebooking.allocation.api.dto.DayReservationsResponse;
import com.dinebooking.allocation.api.dto.DiscoveryRequest;
import com.dinebooking.allocation.api.dto.DiscoveryResponse;
import com.dinebooking.allocation.api.dto.ReservationResponse;
import com.dinebooking.allocation.domain.service.AvailabilityService;
import com.dinebooking.allocation.domain.service.ReservationCommandService;
import com.dinebooking.allocation.domain.service.ReservationQueryService;
import com.dinebooking.common.dto.BaseResponse;
import com.dinebooking.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Discovery and reservation commands for one restaurant sector.
 */
@RestController
@RequestMapping("/api/v1/allocation")
@RequiredArgsConstructor
public class ReservationController {

    private final AvailabilityService availabilityService;
    private final ReservationCommandService commandService;
    private final ReservationQueryService queryService;

    /**
     * Candidates best first. An empty result is reported as {@code no_capacity}.
     */
    @GetMapping("/discover")
    public ResponseEntity<BaseResponse<DiscoveryResponse>> discover(@Valid @ModelAttribute DiscoveryRequest request) {
        return ResponseEntity.ok(BaseResponse.success(availabilityService.discover(request)));
    }

    /**
     * Commits the best candidate. Retrying with the same Idempotency-Key and body replays the
     * original reservation.
     */
    @PostMapping("/reservations")
    public ResponseEntity<BaseResponse<ReservationResponse>> createReservation(
            @RequestHeader(value = Constants.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateReservationRequest request) {
        ReservationResponse response = commandService.createReservation(idempotencyKey, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Reservation confirmed", response));
    }

    @GetMapping("/reservations/day")
    public ResponseEntity<BaseResponse<DayReservationsResponse>> listDay(
            @RequestParam String restaurantId,
            @RequestParam String sectorId,
            @RequestParam String date) {
        return ResponseEntity.ok(BaseResponse.success(queryService.listDay(restaurantId, sectorId, date)));
    }

    @GetMapping("/reservations/{id}")
    public ResponseEntity<BaseResponse<ReservationResponse>> getReservation(@PathVariable String id) {
        return ResponseEntity.ok(BaseResponse.success(queryService.getReservation(id)));
    }

    @DeleteMapping("/reservations/{id}")
    public ResponseEntity<Void> cancelReservation(@PathVariable String id) {
        commandService.cancelReservation(id);
        return ResponseEntity.noContent().build();
    }
}
