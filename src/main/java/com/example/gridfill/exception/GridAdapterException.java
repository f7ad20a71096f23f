package com.example.gridfill.exception;

/**
 * Reading or writing the underlying workbook failed. Always aborts the fill.
 */
public class GridAdapterException extends GridFillException {

    public static final String ADAPTER_FAILURE = "ADAPTER_FAILURE";

    public GridAdapterException(String description, Throwable cause) {
        super(ADAPTER_FAILURE, description, cause);
    }
}
