package com.dinebooking.allocation.api.controller;

import com.dinebooking.allocation.api.dto.BlackoutResponse;
import com.dinebooking.allocation.api.dto.CreateBlackoutRequest;
import com.dinebooking.allocation.api.dto.CreateBlackoutResponse;
import com.dinebooking.allocation.domain.service.BlackoutService;
import com.dinebooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/allocation/blackouts")
@RequiredArgsConstructor
public class BlackoutController {

    private final BlackoutService blackoutService;

    /**
     * Creates a blackout and cancels the confirmed reservations it overlaps.
     */
    @PostMapping
    public ResponseEntity<BaseResponse<CreateBlackoutResponse>> createBlackout(
            @Valid @RequestBody CreateBlackoutRequest request) {
        CreateBlackoutResponse response = blackoutService.createBlackout(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Blackout created", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<BlackoutResponse>>> listBlackouts(
            @RequestParam String restaurantId,
            @RequestParam(required = false) String sectorId,
            @RequestParam String date) {
        return ResponseEntity.ok(BaseResponse.success(blackoutService.listBlackouts(restaurantId, sectorId, date)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteBlackout(@PathVariable String id) {
        blackoutService.deleteBlackout(id);
        return ResponseEntity.noContent().build();
    }
}
