package com.wayfinder.storefront.vision;

public class VisionNotConfiguredException extends VisionException {

    public VisionNotConfiguredException() {
        super("Vision analysis not configured. Add a vision API key in settings.");
    }
}
