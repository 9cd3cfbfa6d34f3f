package com.pinclick.copilot.model;

/**
 * A latitude/longitude pair in decimal degrees.
 */
public record Coordinates(double latitude, double longitude) {
}
