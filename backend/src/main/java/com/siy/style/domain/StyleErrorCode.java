package com.siy.style.domain;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum StyleErrorCode {

    INVALID_COLOR_FORMAT("Color is not a well-formed RGB hex value", HttpStatus.BAD_REQUEST),
    UNKNOWN_CATEGORY("Category is outside the clothing taxonomy", HttpStatus.BAD_REQUEST),
    OUT_OF_RANGE_VALUE("Value is outside its allowed range", HttpStatus.BAD_REQUEST),
    EMPTY_OUTFIT("Outfit must contain a base item", HttpStatus.BAD_REQUEST);

    private final String message;
    private final HttpStatus httpStatus;

    StyleErrorCode(String message, HttpStatus httpStatus) {
        this.message = message;
        this.httpStatus = httpStatus;
    }
}
