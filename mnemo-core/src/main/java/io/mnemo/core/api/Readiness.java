package io.mnemo.core.api;

public record Readiness(boolean ready, String reason) {
}
