package io.hyperfoil.tools.multishell.shell;

import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.lang.invoke.MethodHandles;

/**
 * Connects an {@link OutputStream} that the transport writes into with the {@link InputStream} a drainer reads.
 * Closing the pipe ends the stream for the reader once the buffered bytes are consumed.
 */
public class ChannelPipe {

    final static XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final int PIPE_SIZE = 1024 * 1024;

    private final String name;
    private final PipedInputStream source;
    private final PipedOutputStream sink;
    private volatile boolean closed = false;

    public ChannelPipe(String name) throws IOException {
        this.name = name;
        this.source = new PipedInputStream(PIPE_SIZE);
        this.sink = new PipedOutputStream(source);
    }

    public String getName(){return name;}

    /**
     * @return the side the transport writes to
     */
    public OutputStream getSink(){return sink;}

    /**
     * @return the side the session reads from
     */
    public InputStream getSource(){return source;}

    public boolean isClosed(){return closed;}

    public void close(){
        if(closed){
            return;
        }
        closed = true;
        try {
            sink.close();
        } catch (IOException e) {
            logger.error("{} error closing pipe", name, e);
        }
    }
}
