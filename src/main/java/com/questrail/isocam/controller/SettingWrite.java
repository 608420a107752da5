package com.questrail.isocam.controller;

import com.questrail.isocam.api.SettingName;

import java.util.Objects;

/**
 * One validated driver write: a setting and its clamped, typed value.
 */
public record SettingWrite(SettingName name, Object value)
{
    public SettingWrite {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (!name.valueType().isInstance(value)) {
            throw new IllegalArgumentException(name.wireName() + " expects "
                    + name.valueType().getSimpleName() + " but got " + value.getClass().getSimpleName());
        }
    }
}
