package com.arithmeticexercises;

/** Invalid range bound or problem count. */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}
