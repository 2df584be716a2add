package com.nosota.wagerbook.error;

public class WagerNotFoundException extends NotFoundException {
    public WagerNotFoundException(Long id) {
        super("Wager not found: id=" + id);
    }

    public WagerNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "WAGER_NOT_FOUND";
    }
}
