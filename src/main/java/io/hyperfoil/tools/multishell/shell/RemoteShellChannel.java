package io.hyperfoil.tools.multishell.shell;

import org.apache.sshd.common.channel.PtyMode;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * A channel that can run one interactive program on the remote side.
 * <p>
 * The streams must be available before {@link #start(String)} so no output is lost while the program starts.
 * {@link #close()} must make any pending read on the output and error streams fail or report the end of the stream.
 */
public interface RemoteShellChannel extends Closeable {

    void setEnv(String name, String value) throws IOException;

    void requestPty(String term, int rows, int columns, Map<PtyMode,Integer> modes) throws IOException;

    /**
     * @return the stream connected to the program's standard input, writes fail until the program is started
     */
    OutputStream getInput() throws IOException;

    InputStream getOutput() throws IOException;

    InputStream getError() throws IOException;

    void start(String program) throws IOException;

    boolean isOpen();

    @Override
    void close() throws IOException;
}
