package io.hyperfoil.tools.multishell.shell;

import org.apache.sshd.common.channel.PtyMode;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the shell program as a local process.
 * <p>
 * The process is started with a ProcessBuilder from a command template where {@code ${program}} is replaced by the
 * program passed to {@link #start(String)}. A dedicated thread per process stream copies bytes into the pipes
 * the session reads.
 */
public class LocalShellChannel implements RemoteShellChannel {

    final static XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final String PROGRAM_REFERENCE = "${program}";

    //script allocates a pty for the program, merges stderr into stdout
    public static final List<String> LINUX_PTY_TEMPLATE = Arrays.asList("script", "-q","-c",PROGRAM_REFERENCE,"/dev/null");
    public static final List<String> MACOS_PTY_TEMPLATE = Arrays.asList("script", "-q", "/dev/null", PROGRAM_REFERENCE);
    public static final List<String> SH_TEMPLATE = Arrays.asList("/bin/sh","-c",PROGRAM_REFERENCE);

    public static ShellChannelFactory factory(List<String> template){
        return ()->new LocalShellChannel("local",template);
    }

    private final String name;
    private final List<String> template;
    private final Map<String,String> environment;
    private final ChannelPipe outputPipe;
    private final ChannelPipe errorPipe;
    private final DeferredOutputStream input;
    private File directory;
    private volatile Process process;

    public LocalShellChannel(String name) throws IOException {
        this(name, SH_TEMPLATE);
    }
    public LocalShellChannel(String name, List<String> template) throws IOException {
        this.name = name;
        this.template = template == null || template.isEmpty() ? SH_TEMPLATE : new ArrayList<>(template);
        this.environment = new LinkedHashMap<>();
        this.outputPipe = new ChannelPipe(name+"-stdout");
        this.errorPipe = new ChannelPipe(name+"-stderr");
        this.input = new DeferredOutputStream(name+"-stdin");
        this.directory = new File(System.getProperty("user.home"));
    }

    public LocalShellChannel setDirectory(File directory){
        this.directory = directory;
        return this;
    }

    @Override
    public void setEnv(String key, String value) {
        environment.put(key,value);
    }

    /**
     * A local process has no pty of its own, the terminal type and size are passed through the environment.
     */
    @Override
    public void requestPty(String term, int rows, int columns, Map<PtyMode, Integer> modes) {
        environment.put("TERM",term);
        environment.put("LINES",Integer.toString(rows));
        environment.put("COLUMNS",Integer.toString(columns));
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

    List<String> populate(String program){
        List<String> rtrn = new ArrayList<>(template.size());
        for(String entry : template){
            rtrn.add(entry.replace(PROGRAM_REFERENCE,program));
        }
        return rtrn;
    }

    @Override
    public void start(String program) throws IOException {
        if(process != null){
            throw new IOException(name+" already started "+program);
        }
        List<String> command = populate(program);
        logger.debug("{} starting {}", name, command);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.environment().putAll(environment);
        if(directory != null && directory.isDirectory()){
            pb.directory(directory);
        }
        Process started = pb.start();
        process = started;
        input.setTarget(started.getOutputStream());
        pump(started.getInputStream(), outputPipe);
        pump(started.getErrorStream(), errorPipe);
    }

    private void pump(InputStream in, ChannelPipe pipe){
        Thread thread = new Thread(()->{
            byte[] buff = new byte[10 * 1024];
            int len;
            try {
                while ((len = in.read(buff, 0, buff.length)) >= 0) {
                    if( len>0 ) {
                        OutputStream sink = pipe.getSink();
                        sink.write(buff, 0, len);
                        sink.flush();
                    }
                }
            } catch (IOException e) {
                if(!pipe.isClosed()) {
                    logger.debug("{} error copying {}: {}", name, pipe.getName(), e.getMessage());
                }
            } finally {
                pipe.close();
            }
            logger.debug("{} reader thread is stopping", pipe.getName());
        },pipe.getName());
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public boolean isOpen() {
        Process current = process;
        return current != null && current.isAlive() && !outputPipe.isClosed();
    }

    @Override
    public void close() throws IOException {
        Process current = process;
        try {
            if (current != null && current.isAlive()) {
                current.destroy();
                if (!current.waitFor(1, TimeUnit.SECONDS)) {
                    current.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            logger.error("{} interrupted while waiting for shell to stop", name);
            Thread.currentThread().interrupt();
        } finally {
            outputPipe.close();
            errorPipe.close();
        }
    }

    @Override
    public String toString(){
        return name;
    }
}
