package com.locode.resolution.command;

/**
 * Runtime exception thrown for an unusable command line: unknown command,
 * missing argument or non-numeric value.
 */
public class CommandException extends RuntimeException {

    public CommandException(String message) {
        super(message);
    }

    public CommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
