package com.questrail.isocam.controller;

import com.questrail.isocam.api.SettingName;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of validating a setting write request.
 *
 * <p>A rejection is an ordinary result, not an exception: the caller reports
 * it and the session carries on unchanged.</p>
 */
public sealed interface SettingValidation
        permits SettingValidation.Accepted, SettingValidation.Rejected
{
    /**
     * @param writes driver writes to perform, in order
     * @param echo   settings whose applied values are reported back
     */
    record Accepted(List<SettingWrite> writes, Set<SettingName> echo) implements SettingValidation {
        public Accepted {
            writes = List.copyOf(writes);
            if (writes.isEmpty()) {
                throw new IllegalArgumentException("an accepted write needs at least one driver write");
            }
            EnumSet<SettingName> copy = EnumSet.noneOf(SettingName.class);
            copy.addAll(echo);
            echo = Collections.unmodifiableSet(copy);
        }
    }

    record Rejected(String reason) implements SettingValidation {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
