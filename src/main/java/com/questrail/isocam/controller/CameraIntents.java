package com.questrail.isocam.controller;

import com.questrail.isocam.api.SettingName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * CameraIntents
 * -----------------------------------------------------------------------------
 * Immutable collection of driver actions emitted by the
 * {@link CameraStateReducer}.
 *
 * <h2>Role in the architecture</h2>
 * {@code CameraIntents} is the bridge between:
 * <ul>
 *   <li>pure, deterministic session transition logic</li>
 *   <li>impure driver calls made on the control-loop thread</li>
 * </ul>
 *
 * The reducer determines <b>what should happen next</b>; the
 * {@link CameraController} performs the driver calls and publishes the
 * resulting events. Kinds are executed in declaration order.
 */
public final class CameraIntents
{
    /**
     * Enumerates the kinds of actions the controller may need to perform.
     */
    public enum Kind {
        /** Open the camera, read its settings, publish them. */
        OPEN,

        /** Apply validated setting writes and echo the applied values. */
        WRITE_SETTINGS,

        /** Disarm the camera and report {@code playing=false}. */
        DISARM,

        /** Release the camera; the session ends. */
        CLOSE,

        /** Arm the camera for acquisition. */
        ARM,

        /** Issue a software trigger after arming. */
        SOFTWARE_TRIGGER,

        /** Report a rejected request; no driver call. */
        REJECT
    }

    private final Set<Kind> kinds;
    private final List<SettingWrite> writes;
    private final Set<SettingName> echo;
    private final String rejection;

    private CameraIntents(Set<Kind> kinds, List<SettingWrite> writes, Set<SettingName> echo, String rejection) {
        EnumSet<Kind> k = EnumSet.noneOf(Kind.class);
        k.addAll(kinds);
        EnumSet<SettingName> e = EnumSet.noneOf(SettingName.class);
        e.addAll(echo);

        this.kinds = Collections.unmodifiableSet(k);
        this.writes = List.copyOf(writes);
        this.echo = Collections.unmodifiableSet(e);
        this.rejection = rejection;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    public boolean isRejection() {
        return kinds.contains(Kind.REJECT);
    }

    /**
     * Driver writes for {@link Kind#WRITE_SETTINGS}, in execution order.
     */
    public List<SettingWrite> writes() {
        return writes;
    }

    /**
     * Settings to echo after {@link Kind#WRITE_SETTINGS}.
     */
    public Set<SettingName> echo() {
        return echo;
    }

    public Optional<String> rejection() {
        return Optional.ofNullable(rejection);
    }

    // ---------------------------------------------------------------------
    // Factory methods
    // ---------------------------------------------------------------------

    public static CameraIntents none() {
        return new CameraIntents(Set.of(), List.of(), Set.of(), null);
    }

    public static CameraIntents open() {
        return new CameraIntents(EnumSet.of(Kind.OPEN), List.of(), Set.of(), null);
    }

    public static CameraIntents writeSettings(List<SettingWrite> writes, Set<SettingName> echo) {
        Objects.requireNonNull(writes, "writes");
        Objects.requireNonNull(echo, "echo");
        return new CameraIntents(EnumSet.of(Kind.WRITE_SETTINGS), writes, echo, null);
    }

    public static CameraIntents disarm() {
        return new CameraIntents(EnumSet.of(Kind.DISARM), List.of(), Set.of(), null);
    }

    public static CameraIntents close() {
        return new CameraIntents(EnumSet.of(Kind.CLOSE), List.of(), Set.of(), null);
    }

    public static CameraIntents arm() {
        return new CameraIntents(EnumSet.of(Kind.ARM), List.of(), Set.of(), null);
    }

    public static CameraIntents softwareTrigger() {
        return new CameraIntents(EnumSet.of(Kind.SOFTWARE_TRIGGER), List.of(), Set.of(), null);
    }

    public static CameraIntents reject(String reason) {
        Objects.requireNonNull(reason, "reason");
        return new CameraIntents(EnumSet.of(Kind.REJECT), List.of(), Set.of(), reason);
    }

    // ---------------------------------------------------------------------
    // Composition
    // ---------------------------------------------------------------------

    /**
     * Combines this set of intents with another.
     *
     * <p>A rejection cannot be combined with any other intent.</p>
     */
    public CameraIntents and(CameraIntents other) {
        Objects.requireNonNull(other, "other");

        if ((isRejection() || other.isRejection()) && !(isEmpty() || other.isEmpty())) {
            throw new IllegalArgumentException("A rejection cannot be combined with other intents");
        }

        EnumSet<Kind> merged = EnumSet.noneOf(Kind.class);
        merged.addAll(this.kinds);
        merged.addAll(other.kinds);

        List<SettingWrite> mergedWrites = new ArrayList<>(this.writes);
        mergedWrites.addAll(other.writes);

        EnumSet<SettingName> mergedEcho = EnumSet.noneOf(SettingName.class);
        mergedEcho.addAll(this.echo);
        mergedEcho.addAll(other.echo);

        return new CameraIntents(merged, mergedWrites, mergedEcho,
                rejection != null ? rejection : other.rejection);
    }

    @Override
    public String toString() {
        return "CameraIntents" + kinds;
    }
}
