package com.questrail.isocam.observability;

/**
 * Main interface for receiving camera service observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface CameraObservabilitySink {
    /**
     * Sink that drops every event; used when a component is built without one.
     */
    CameraObservabilitySink NONE = new CameraObservabilitySink() {
        @Override
        public void onStateTransition(CameraStateTransitionEvent event) {}

        @Override
        public void onTransportEvent(CameraTransportEvent event) {}

        @Override
        public void onError(CameraErrorEvent event) {}
    };

    /**
     * Called when the camera controller applies a request.
     * @param event the transition event details
     */
    void onStateTransition(CameraStateTransitionEvent event);

    /**
     * Called when a connection-level event occurs (connected, disconnected, frame rejected).
     * @param event the transport event
     */
    void onTransportEvent(CameraTransportEvent event);

    /**
     * Called when an error or anomaly occurs anywhere in the service.
     * @param event the error event
     */
    void onError(CameraErrorEvent event);
}
