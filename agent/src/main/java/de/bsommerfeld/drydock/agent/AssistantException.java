package de.bsommerfeld.drydock.agent;

/**
 * The local assistant server could not produce a reply.
 */
public class AssistantException extends Exception {

    public AssistantException(String message) {
        super(message);
    }

    public AssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
