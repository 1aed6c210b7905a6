package io.hyperfoil.tools.multishell.shell;

import org.apache.sshd.client.channel.ChannelExec;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.channel.Channel;
import org.apache.sshd.common.channel.ChannelListener;
import org.apache.sshd.common.channel.PtyChannelConfiguration;
import org.apache.sshd.common.channel.PtyMode;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the shell program in an ssh exec channel with a pseudo-terminal.
 * <p>
 * The output and error pipes are registered with the channel before it opens so the drainers can be reading
 * before the program produces its first byte. The pipes are closed when the channel closes, from either side.
 */
public class SshShellChannel implements RemoteShellChannel {

    final static XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final long DEFAULT_OPEN_TIMEOUT = TimeUnit.SECONDS.toMillis(10);

    private class ChannelWatcher implements ChannelListener {
        @Override
        public void channelOpenFailure(Channel channel, Throwable reason) {
            logger.debug("{} channel failed to open: {}", name, reason == null ? "" : reason.getMessage());
            closePipes();
        }

        @Override
        public void channelClosed(Channel channel, Throwable reason) {
            logger.debug("{} channel closed", name);
            closePipes();
        }
    }

    private final String name;
    private final ClientSession clientSession;
    private final long openTimeout;
    private final PtyChannelConfiguration ptyConfig;
    private final Map<String,Object> environment;
    private final ChannelPipe outputPipe;
    private final ChannelPipe errorPipe;
    private final DeferredOutputStream input;
    private boolean usePty = false;
    private volatile ChannelExec channel;

    public SshShellChannel(String name, ClientSession clientSession) throws IOException {
        this(name,clientSession,DEFAULT_OPEN_TIMEOUT);
    }
    public SshShellChannel(String name, ClientSession clientSession, long openTimeout) throws IOException {
        this.name = name;
        this.clientSession = clientSession;
        this.openTimeout = openTimeout;
        this.ptyConfig = new PtyChannelConfiguration();
        this.environment = new LinkedHashMap<>();
        this.outputPipe = new ChannelPipe(name+"-stdout");
        this.errorPipe = new ChannelPipe(name+"-stderr");
        this.input = new DeferredOutputStream(name+"-stdin");
    }

    @Override
    public void setEnv(String key, String value) throws IOException {
        if(channel != null){
            throw new IOException(name+" cannot set "+key+" after the channel started");
        }
        environment.put(key,value);
    }

    @Override
    public void requestPty(String term, int rows, int columns, Map<PtyMode, Integer> modes) throws IOException {
        if(channel != null){
            throw new IOException(name+" cannot request a pty after the channel started");
        }
        ptyConfig.setPtyType(term);
        ptyConfig.setPtyLines(rows);
        ptyConfig.setPtyColumns(columns);
        ptyConfig.setPtyModes(modes == null ? new EnumMap<>(PtyMode.class) : new EnumMap<>(modes));
        usePty = true;
    }

    @Override
    public OutputStream getInput() {
        return input;
    }

    @Override
    public InputStream getOutput() {
        return outputPipe.getSource();
    }

    @Override
    public InputStream getError() {
        return errorPipe.getSource();
    }

    @Override
    public void start(String program) throws IOException {
        if(channel != null){
            throw new IOException(name+" already started "+program);
        }
        logger.debug("{} starting {}", name, program);
        ChannelExec exec = clientSession.createExecChannel(program, ptyConfig, environment);
        exec.setUsePty(usePty);
        exec.setOut(outputPipe.getSink());
        exec.setErr(errorPipe.getSink());
        exec.addChannelListener(new ChannelWatcher());
        channel = exec;
        try {
            if (!exec.open().verify(openTimeout).isOpened()) {
                throw new IOException(name + " failed to open channel for " + program);
            }
        }catch(IOException e){
            exec.close(true);
            closePipes();
            throw e;
        }
        input.setTarget(exec.getInvertedIn());
    }

    @Override
    public boolean isOpen() {
        ChannelExec current = channel;
        return current != null && current.isOpen() && !outputPipe.isClosed();
    }

    private void closePipes(){
        outputPipe.close();
        errorPipe.close();
    }

    @Override
    public void close() throws IOException {
        ChannelExec current = channel;
        try {
            if (current != null && current.isOpen()) {
                current.close(false).await(openTimeout);
            }
        } finally {
            closePipes();
        }
    }

    @Override
    public String toString(){
        return name;
    }
}
