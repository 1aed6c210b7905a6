package io.hyperfoil.tools.multishell;

import java.io.IOException;

/**
 * Runs commands one after another in a single interactive shell.
 * <p>
 * A command is complete when the accumulated output matches one of the terminators or the timeout expires.
 * Terminators are strings: {@code ^text} must start the output, {@code text$} must end it and anything else
 * may appear anywhere. Without terminators the shell prompt learned when the session started is expected at
 * the end of the output.
 * <p>
 * Implementations do not lock, callers must not run commands concurrently on the same session.
 */
public interface MultiCommandSession extends AutoCloseable {

    /**
     * Sends the command and waits for its output.
     *
     * @param command the command line, a newline is appended
     * @param timeoutMs maximum time to wait for the output, 0 uses the session default
     * @param terminators patterns that mark the end of the output
     * @return the output without the trailing prompt
     * @throws RemoteErrorException if the shell wrote to the error stream, carries the partial output
     * @throws IOException if the command could not be sent
     */
    String run(String command, int timeoutMs, String...terminators) throws IOException;

    /**
     * Same as {@link #run(String, int, String...)} but reports error stream text in the response instead of throwing.
     */
    Response send(String command, int timeoutMs, String...terminators) throws IOException;

    String getShellPrompt();

    String getKernelName();

    boolean isOpen();

    @Override
    void close();
}
