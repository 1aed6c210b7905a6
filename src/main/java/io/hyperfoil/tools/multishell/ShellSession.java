package io.hyperfoil.tools.multishell;

import io.hyperfoil.tools.multishell.config.SessionConfig;
import io.hyperfoil.tools.multishell.shell.RemoteShellChannel;
import io.hyperfoil.tools.multishell.shell.ShellChannelFactory;
import io.hyperfoil.tools.multishell.stream.Chunk;
import io.hyperfoil.tools.multishell.stream.ChunkQueue;
import io.hyperfoil.tools.multishell.stream.StreamDrainer;
import io.hyperfoil.tools.multishell.stream.Terminator;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An interactive shell on a {@link RemoteShellChannel}.
 * <p>
 * Opening the session starts a drainer for the output and error streams before the shell program starts, absorbs
 * the startup banner, learns the prompt by sending an empty command and asks the remote side for its kernel name.
 * A read failure on either stream closes the whole session.
 */
public class ShellSession implements MultiCommandSession {

    final static XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    private static final AtomicInteger UID = new AtomicInteger();

    /**
     * Opens a channel from the factory and performs the startup handshake.
     * A failure closes anything that was opened, no partially started session is returned.
     */
    public static ShellSession open(ShellChannelFactory factory, SessionConfig config) throws IOException {
        if(config == null){
            config = new SessionConfig();
        }
        config.applyDefaults();
        factory.addSecrets(config.getFilter());
        RemoteShellChannel channel = factory.openChannel();
        if(channel == null){
            throw new IOException("no channel available for "+config.getName());
        }
        try {
            for (Map.Entry<String, String> entry : config.getEnvironment().entrySet()) {
                channel.setEnv(entry.getKey(), entry.getValue());
            }
            channel.requestPty(config.getTerm(), config.getRows(), config.getColumns(), config.getTerminalModes());
        }catch(IOException e){
            closeChannel(channel, config.getName());
            throw new IOException("failed to prepare channel "+channel+": "+e.getMessage(), e);
        }
        ShellSession session = new ShellSession(channel, config);
        try{
            session.init();
        }catch(IOException e){
            logger.debug("{} failed to start: {}", session.getName(), e.getMessage());
            session.close();
            throw e;
        }
        return session;
    }

    private static void closeChannel(RemoteShellChannel channel, String name){
        try {
            channel.close();
        } catch (IOException e) {
            logger.error("{} error closing channel {}", name, channel, e);
        }
    }

    private final String name;
    private final SessionConfig config;
    private final SecretFilter filter;
    private final RemoteShellChannel channel;
    private final ChunkQueue queue;
    private final AtomicBoolean running;
    private final ResponseCollector collector;
    private final ExecutorService executor;
    private OutputStream input;
    private volatile String shellPrompt = "";
    private volatile String kernelName = "";

    ShellSession(RemoteShellChannel channel, SessionConfig config){
        this.config = config;
        this.name = config.hasName() ? config.getName() : "shell-"+UID.incrementAndGet();
        this.filter = config.getFilter();
        this.channel = channel;
        this.queue = new ChunkQueue();
        this.running = new AtomicBoolean(true);
        this.collector = new ResponseCollector(name, queue, this::getShellPrompt, config.getTimeout());
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, name + "-drainer-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    void init() throws IOException {
        input = channel.getInput();
        InputStream output = channel.getOutput();
        InputStream error = channel.getError();

        startDrainer(Chunk.Source.Output, output);
        startDrainer(Chunk.Source.Error, error);

        logger.debug("{} starting {}", name, config.getShell());
        try {
            channel.start(config.getShell());
        }catch(IOException e){
            throw new IOException(name+" failed to start "+config.getShell()+": "+e.getMessage(), e);
        }

        Response banner = collector.read(config.getBannerTimeout(), Collections.emptyList());
        if(banner.hasError()){
            throw banner.toException(config.getShell());
        }
        logger.trace("{} banner: {}", name, banner.getOutput());

        String prompt = run("", config.getPromptTimeout());
        shellPrompt = ResponseCollector.stripLeadingLineBreaks(prompt);
        if(shellPrompt.isEmpty()){
            logger.warn("{} did not detect a shell prompt", name);
        }else{
            logger.debug("{} shell prompt: {}", name, shellPrompt);
        }
        collector.drain();

        String kernel = run(config.getKernelCommand(), config.getKernelTimeout(), SessionConfig.DEFAULT_KERNEL_TERMINATORS.toArray(new String[0]));
        collector.drain();
        kernelName = normalizeKernel(kernel);
        logger.debug("{} kernel: {}", name, kernelName);
    }

    /**
     * First non blank line of the probe output, trimmed and in lower case.
     */
    static String normalizeKernel(String output){
        if(output == null){
            return "";
        }
        for(String line : output.split("\r?\n")){
            String trimmed = line.trim();
            if(!trimmed.isEmpty()){
                return trimmed.toLowerCase(Locale.ROOT);
            }
        }
        return "";
    }

    ChunkQueue getQueue(){return queue;}

    private void startDrainer(Chunk.Source source, InputStream stream) throws IOException {
        StreamDrainer drainer = new StreamDrainer(name, source, stream, queue, running, this::close);
        if(config.isTrace()){
            Path tracePath = Files.createTempFile("multishell."+name+"."+source.getName(), ".raw.log");
            logger.info("{} tracing {} to {}", name, source.getName(), tracePath.toAbsolutePath());
            drainer.setTrace(new FileOutputStream(tracePath.toFile()));
        }
        executor.submit(drainer);
    }

    public String getName(){return name;}

    @Override
    public String run(String command, int timeoutMs, String... terminators) throws IOException {
        Response response = send(command, timeoutMs, terminators);
        if(response.hasError()){
            throw response.toException(command);
        }
        return response.getOutput();
    }

    @Override
    public Response send(String command, int timeoutMs, String... terminators) throws IOException {
        if(command == null){
            command = "";
        }
        if(!running.get()){
            throw new IOException(name+" is closed, cannot execute command: "+filter.filter(command));
        }
        collector.drain();
        logger.trace("{} sh: {}", name, filter.filter(command));
        try {
            input.write((command + "\n").getBytes(StandardCharsets.UTF_8));
            input.flush();
        }catch(IOException e){
            throw new IOException("failed to execute command: "+filter.filter(command)+", "+e.getMessage(), e);
        }
        return collector.read(timeoutMs, Terminator.parse(terminators));
    }

    /**
     * @return the prompt the shell printed when it was idle after starting, empty if none was detected
     */
    @Override
    public String getShellPrompt() {
        return shellPrompt;
    }

    /**
     * @return lower case output of the kernel probe, e.g. {@code linux} or {@code darwin}
     */
    @Override
    public String getKernelName() {
        return kernelName;
    }

    @Override
    public boolean isOpen() {
        return running.get() && channel.isOpen();
    }

    @Override
    public void close() {
        if(!running.compareAndSet(true,false)){
            return;
        }
        logger.debug("{} closing", name);
        if(input != null){
            try {
                input.close();
            } catch (IOException e) {
                logger.debug("{} error closing input: {}", name, e.getMessage());
            }
        }
        closeChannel(channel, name);
        executor.shutdownNow();
    }

    @Override
    public String toString(){
        return name;
    }
}
