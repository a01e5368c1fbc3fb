package com.geotool.api;

/**
 * Presents short, non-fatal messages to the user.
 */
public interface MessageService {

    void info(String message);
}
