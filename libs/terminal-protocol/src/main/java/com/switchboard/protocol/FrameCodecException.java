package com.switchboard.protocol;

/**
 * Thrown when a frame cannot be parsed or an envelope cannot be written.
 */
public class FrameCodecException extends RuntimeException {

    public FrameCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
