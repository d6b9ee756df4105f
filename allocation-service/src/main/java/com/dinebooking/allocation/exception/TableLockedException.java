package com.dinebooking.allocation.exception;

import com.dinebooking.common.exception.BusinessException;

public class TableLockedException extends BusinessException {

    public static final String TABLE_LOCKED = "table_locked";

    public TableLockedException(String message) {
        super(message, TABLE_LOCKED);
    }

    public TableLockedException(String message, Throwable cause) {
        super(message, cause, TABLE_LOCKED);
    }
}
