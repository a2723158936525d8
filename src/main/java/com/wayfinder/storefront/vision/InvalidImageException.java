package com.wayfinder.storefront.vision;

public class InvalidImageException extends VisionException {

    public InvalidImageException(String message) {
        super(message);
    }
}
