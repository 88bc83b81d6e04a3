package io.parareq.error;

/**
 * An input line could not be turned into a job. Fatal for the run: the batch stops at the offending line.
 */
public class MalformedInputException extends RuntimeException {
    private final String input;
    private final long line;

    public MalformedInputException(String input, long line, String reason, Throwable cause) {
        super("Malformed input at " + input + ":" + line + ": " + reason, cause);
        this.input = input;
        this.line = line;
    }

    public String input() { return input; }
    public long line() { return line; }
}
