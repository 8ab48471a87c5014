package com.coursepicker.coursepicker_api.exception;

/**
 * Thrown when a weekly time pattern such as {@code "mon. 09:00-10:30; wed. 14:00-15:30"}
 * cannot be parsed. Nothing of the pattern is kept when this is thrown.
 */
public class TimeFormatException extends IllegalArgumentException {

    private final String entry;

    public TimeFormatException(String entry, String reason) {
        super("Invalid time entry '" + entry + "': " + reason);
        this.entry = entry;
    }

    public TimeFormatException(String entry, String reason, Throwable cause) {
        super("Invalid time entry '" + entry + "': " + reason, cause);
        this.entry = entry;
    }

    public String getEntry() {
        return entry;
    }
}
