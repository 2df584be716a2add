package com.nosota.wagerbook.error;

public class EventNotFoundException extends NotFoundException {
    public EventNotFoundException(Long id) {
        super("Event not found: id=" + id);
    }

    public EventNotFoundException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "EVENT_NOT_FOUND";
    }
}
