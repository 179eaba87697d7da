package com.project.image.mosaic.service.match;

import com.project.image.mosaic.DTOs.MosaicRequest;

public final class MatchStrategies {

    private MatchStrategies() {
    }

    public static MatchStrategy forRequest(MosaicRequest request) {
        int alpha = request.overlayAlpha();
        switch (request.strategy()) {
            case COLOR:
                return new ColorMatchStrategy(request.colorTolerance(), request.flatColorFill(), alpha);
            case HUE:
                return new HueMatchStrategy(request.hueTolerance(), request.saturationWeight(),
                        request.brightnessWeight(), alpha);
            case PHOTO:
                return new PhotoMatchStrategy(request.similarityThreshold(), request.avoidRepetition(),
                        request.maxImageReuse(), request.repetitionPenalty(), alpha);
            default:
                throw new IllegalArgumentException("Unknown match strategy: " + request.strategy());
        }
    }
}
