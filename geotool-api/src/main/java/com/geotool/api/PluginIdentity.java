package com.geotool.api;

import java.util.Objects;

/**
 * Identity of the plugin that contributes a tool.
 */
public record PluginIdentity(String name, String author, String guid) {

    public PluginIdentity {
        Objects.requireNonNull(name, "name");
        author = author != null ? author : "";
        guid = guid != null ? guid : "";
    }
}
