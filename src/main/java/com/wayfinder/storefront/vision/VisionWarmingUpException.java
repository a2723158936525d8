package com.wayfinder.storefront.vision;

/**
 * The vision model is scaled to zero and still loading; a retry a minute later usually succeeds.
 */
public class VisionWarmingUpException extends VisionException {

    public VisionWarmingUpException(String message) {
        super(message);
    }
}
