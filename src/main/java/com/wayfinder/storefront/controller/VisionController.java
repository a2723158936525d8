package com.wayfinder.storefront.controller;

import com.wayfinder.storefront.model.api.VisionAnalyzeRequest;
import com.wayfinder.storefront.model.api.VisionAnalyzeResponse;
import com.wayfinder.storefront.model.api.VisionWarmResponse;
import com.wayfinder.storefront.vision.VisionException;
import com.wayfinder.storefront.vision.VisionNotConfiguredException;
import com.wayfinder.storefront.vision.VisionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/vision")
public class VisionController {

    private static final Logger log = LoggerFactory.getLogger(VisionController.class);

    private final VisionService visionService;

    public VisionController(VisionService visionService) {
        this.visionService = visionService;
    }

    @PostMapping("/analyze")
    public Mono<VisionAnalyzeResponse> analyze(@Valid @RequestBody VisionAnalyzeRequest request) {
        if (!visionService.isConfigured()) {
            throw new VisionNotConfiguredException();
        }
        return visionService.analyze(request.imageBase64(), request.prompt())
                .doOnNext(result -> log.info("Vision analysis complete ({} chars)", result.description().length()))
                .map(result -> new VisionAnalyzeResponse(result.description(), true))
                .onErrorMap(ex -> !(ex instanceof VisionException), ex -> new VisionException(String.valueOf(ex.getMessage()), ex));
    }

    @PostMapping("/warm")
    public Mono<VisionWarmResponse> warm() {
        return visionService.warm()
                .doOnNext(status -> log.info("Vision warm ping status={}", status.value()))
                .map(status -> new VisionWarmResponse(status.value()));
    }
}
