package io.mnemo.core.store;

public record Availability(boolean available, String reason, boolean vectorAvailable) {

    public static Availability ready(boolean vectorAvailable, String vectorReason) {
        return new Availability(true, vectorAvailable ? null : vectorReason, vectorAvailable);
    }

    public static Availability unavailable(String reason) {
        return new Availability(false, reason, false);
    }
}
