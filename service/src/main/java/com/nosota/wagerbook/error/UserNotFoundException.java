package com.nosota.wagerbook.error;

public class UserNotFoundException extends NotFoundException {
    public UserNotFoundException(Long id) {
        super("User not found: id=" + id);
    }

    public UserNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "USER_NOT_FOUND";
    }
}
