package com.siy.style.dto;

/**
 * Accepted for compatibility with clients that send it; the service derives HSL from hex.
 */
public record HslPayload(Double h, Double s, Double l) {
}
