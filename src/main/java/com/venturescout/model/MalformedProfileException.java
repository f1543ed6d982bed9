package com.venturescout.model;

/**
 * A profile is missing data the engine cannot score without, such as a candidate or
 * organization name. Raised before a batch starts.
 */
public class MalformedProfileException extends IllegalArgumentException {
    public MalformedProfileException(String message) {
        super(message);
    }
}
