package com.questrail.isocam.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CameraObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCameraObservabilitySink implements CameraObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCameraObservabilitySink.class);

    @Override
    public void onStateTransition(CameraStateTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.info("Camera {}: Phase {} -> {}",
                event.newState().serial(),
                event.oldState().phase(),
                event.newState().phase());
        }
        else if (event.resultingIntents().isRejection()) {
            log.info("Camera {}: rejected {}: {}",
                event.newState().serial(),
                event.triggeringRequest().tag().wireName(),
                event.resultingIntents().rejection().orElse(""));
        }
        else {
            log.debug("Camera {}: {} -> {}",
                event.newState().serial(),
                event.triggeringRequest(),
                event.resultingIntents().kinds());
        }
    }

    @Override
    public void onTransportEvent(CameraTransportEvent event) {
        log.info("Camera Transport Event ({}): {} {}", event.side(), event.kind(), event.detail());
    }

    @Override
    public void onError(CameraErrorEvent event) {
        log.error("Camera Error: {}", event.message(), event.cause());
    }
}
