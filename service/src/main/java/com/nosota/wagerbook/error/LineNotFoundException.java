package com.nosota.wagerbook.error;

public class LineNotFoundException extends NotFoundException {
    public LineNotFoundException(Long id) {
        super("Line not found: id=" + id);
    }

    public LineNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "LINE_NOT_FOUND";
    }
}
