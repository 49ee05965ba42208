package com.fitplan.backend.sheet.render;

public class SheetRenderException extends RuntimeException {
    public SheetRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
