package com.questrail.isocam.controller;

import com.questrail.isocam.api.TriggerType;
import com.questrail.isocam.protocol.model.CameraRequest;

import java.util.Objects;

/**
 * CameraStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic state transition engine for one camera session.
 *
 * <h2>Role in the architecture</h2>
 * Given a prior {@link CameraSessionState} and a single {@link CameraRequest},
 * the reducer computes:
 * <ul>
 *   <li>a new {@link CameraSessionState}</li>
 *   <li>the {@link CameraIntents} the controller must carry out</li>
 * </ul>
 *
 * The reducer never calls the driver. Execution, and folding driver results
 * back into the settings snapshot, is the job of {@link CameraController}.
 *
 * <h2>Transitions</h2>
 * <pre>
 *   CLOSED   open_cam    -&gt; OPEN      OPEN
 *   OPEN     play        -&gt; PLAYING   ARM (+ SOFTWARE_TRIGGER)
 *   PLAYING  stop        -&gt; OPEN      DISARM
 *   OPEN     setting     -&gt; OPEN      WRITE_SETTINGS   (any setting)
 *   PLAYING  setting     -&gt; PLAYING   WRITE_SETTINGS   (play settings only)
 *   OPEN     close_cam   -&gt; CLOSED    CLOSE
 *   PLAYING  close_cam   -&gt; CLOSED    DISARM, CLOSE
 * </pre>
 *
 * Anything else is a rejection: the state is returned unchanged together with
 * a single {@link CameraIntents.Kind#REJECT} intent.
 */
public final class CameraStateReducer
{
    public static final String NO_CAMERA = "No camera has been opened";
    public static final String ALREADY_OPEN = "Camera has already been opened";
    public static final String ALREADY_PLAYING = "Camera is already playing";
    public static final String NOT_PLAYING = "Camera is not playing";

    /**
     * Result of applying a request to a session state.
     *
     * @param newState the updated session state
     * @param intents  driver actions to be executed by the caller
     */
    public record Result(CameraSessionState newState,
                         CameraIntents intents) {}

    private final SettingsPolicy settingsPolicy;

    public CameraStateReducer() {
        this(new SettingsPolicy());
    }

    public CameraStateReducer(SettingsPolicy settingsPolicy) {
        this.settingsPolicy = Objects.requireNonNull(settingsPolicy, "settingsPolicy");
    }

    /**
     * Applies a single request to the current session state.
     *
     * @param state   the current state (must not be {@code null})
     * @param request the request to apply (must not be {@code null})
     * @return the resulting state and intents
     */
    public Result apply(CameraSessionState state, CameraRequest request) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(request, "request");

        if (request instanceof CameraRequest.OpenCamera) {
            return onOpen(state);
        }
        if (request instanceof CameraRequest.CloseCamera) {
            return onClose(state);
        }
        if (request instanceof CameraRequest.Play) {
            return onPlay(state);
        }
        if (request instanceof CameraRequest.Stop) {
            return onStop(state);
        }
        if (request instanceof CameraRequest.WriteSetting r) {
            return onWriteSetting(state, r);
        }

        // serials and eof are connection-level and never reach a session.
        return new Result(state, CameraIntents.none());
    }

    // ---------------------------------------------------------------------
    // Request handlers
    // ---------------------------------------------------------------------

    private Result onOpen(CameraSessionState state) {
        if (state.isOpen()) {
            return rejected(state, ALREADY_OPEN);
        }
        return new Result(state.withPhase(CameraSessionState.Phase.OPEN), CameraIntents.open());
    }

    private Result onClose(CameraSessionState state) {
        return switch (state.phase()) {
            case CLOSED -> rejected(state, NO_CAMERA);
            case OPEN -> new Result(state.withPhase(CameraSessionState.Phase.CLOSED),
                    CameraIntents.close());
            case PLAYING -> new Result(state.withPhase(CameraSessionState.Phase.CLOSED),
                    CameraIntents.disarm().and(CameraIntents.close()));
        };
    }

    private Result onPlay(CameraSessionState state) {
        return switch (state.phase()) {
            case CLOSED -> rejected(state, NO_CAMERA);
            case PLAYING -> rejected(state, ALREADY_PLAYING);
            case OPEN -> {
                CameraIntents intents = CameraIntents.arm();
                if (state.settings().triggerType() == TriggerType.SOFTWARE) {
                    intents = intents.and(CameraIntents.softwareTrigger());
                }
                yield new Result(state.withPhase(CameraSessionState.Phase.PLAYING), intents);
            }
        };
    }

    private Result onStop(CameraSessionState state) {
        return switch (state.phase()) {
            case CLOSED -> rejected(state, NO_CAMERA);
            case OPEN -> rejected(state, NOT_PLAYING);
            case PLAYING -> new Result(state.withPhase(CameraSessionState.Phase.OPEN),
                    CameraIntents.disarm());
        };
    }

    private Result onWriteSetting(CameraSessionState state, CameraRequest.WriteSetting request) {
        if (!state.isOpen()) {
            return rejected(state, NO_CAMERA);
        }

        SettingValidation validation = settingsPolicy.validate(
                state.settings(), state.isPlaying(), request.name(), request.value());

        if (validation instanceof SettingValidation.Accepted accepted) {
            return new Result(state, CameraIntents.writeSettings(accepted.writes(), accepted.echo()));
        }
        return rejected(state, ((SettingValidation.Rejected) validation).reason());
    }

    private static Result rejected(CameraSessionState state, String reason) {
        return new Result(state, CameraIntents.reject(reason));
    }
}
