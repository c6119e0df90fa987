package com.extractpilot.orchestrator.judge;

/**
 * The judge could not be invoked (timeout, transport or API error).
 *
 * Unparseable judge output is not an exception: it becomes an ESCALATE
 * verdict. This type is only for calls that produced no text at all, which
 * the retry controller records as a failed attempt.
 */
public class JudgeException extends RuntimeException {

    public JudgeException(String message) {
        super(message);
    }

    public JudgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
