package com.agentdispatch.core.plugin;

import com.agentdispatch.core.DispatchException;

/**
 * Thrown when a registered plugin cannot be instantiated.
 */
public class PluginLoadException extends DispatchException {

    public PluginLoadException(String message) {
        super(message);
    }

    public PluginLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
