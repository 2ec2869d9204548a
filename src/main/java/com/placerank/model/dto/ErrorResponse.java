package com.placerank.model.dto;

/**
 * Error body returned by the REST layer.
 */
public record ErrorResponse(String code, String message) {
}
