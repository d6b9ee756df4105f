package com.dinebooking.allocation.api.exception;

import com.dinebooking.allocation.exception.NoCapacityException;
import com.dinebooking.allocation.exception.OutsideServiceWindowException;
import com.dinebooking.allocation.exception.TableLockedException;
import com.dinebooking.common.dto.BaseResponse;
import com.dinebooking.common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Allocation outcomes that are not plain bad requests: capacity and lock conflicts are 409,
 * a window outside service hours is 422. Everything else falls through to the global handler.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class AllocationExceptionHandler {

    @ExceptionHandler({NoCapacityException.class, TableLockedException.class})
    public ResponseEntity<BaseResponse<?>> handleConflict(BusinessException ex) {
        log.warn("Allocation conflict [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(OutsideServiceWindowException.class)
    public ResponseEntity<BaseResponse<?>> handleOutsideServiceWindow(OutsideServiceWindowException ex) {
        log.warn("Outside service window: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }
}
