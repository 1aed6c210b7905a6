package io.hyperfoil.tools.multishell.stream;

import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads one of the shell streams until the session stops and hands each read to the {@link ChunkQueue} as one chunk.
 * Any read failure, including the end of the stream, invokes the failure callback which tears down the whole session.
 * <p>
 * A character split across two reads is carried over and decoded with the second read.
 */
public class StreamDrainer implements Runnable {

    final static XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final int BUFFER_SIZE = 128 * 1024;

    private final String name;
    private final Chunk.Source source;
    private final InputStream stream;
    private final ChunkQueue queue;
    private final AtomicBoolean running;
    private final Runnable onFailure;
    private final CharsetDecoder decoder;
    private OutputStream trace;

    public StreamDrainer(String name, Chunk.Source source, InputStream stream, ChunkQueue queue, AtomicBoolean running, Runnable onFailure){
        this(name,source,stream,queue,running,onFailure,StandardCharsets.UTF_8);
    }
    public StreamDrainer(String name, Chunk.Source source, InputStream stream, ChunkQueue queue, AtomicBoolean running, Runnable onFailure, Charset charset){
        this.name = name;
        this.source = source;
        this.stream = stream;
        this.queue = queue;
        this.running = running;
        this.onFailure = onFailure;
        this.decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    public String getName(){return name;}
    public Chunk.Source getSource(){return source;}

    /**
     * Copies every byte read to the stream, used for raw session traces.
     */
    public void setTrace(OutputStream trace){
        this.trace = trace;
    }
    public boolean hasTrace(){return trace!=null;}

    @Override
    public void run() {
        ByteBuffer bytes = ByteBuffer.allocate(BUFFER_SIZE);
        CharBuffer chars = CharBuffer.allocate((int) Math.ceil(BUFFER_SIZE * (double) decoder.maxCharsPerByte()));
        try {
            while (running.get()) {
                int offset = bytes.position();
                int read = stream.read(bytes.array(), offset, bytes.remaining());
                if (read < 0) {
                    logger.debug("{} {} reached end of stream", name, source.getName());
                    if (bytes.position() > 0) {
                        logger.debug("{} {} dropped {} bytes of an incomplete character", name, source.getName(), bytes.position());
                    }
                    fail();
                    return;
                }
                if (read > 0) {
                    trace(bytes.array(), offset, read);
                    logger.trace("{} {} read {} bytes", name, source.getName(), read);
                    bytes.position(offset + read);
                    bytes.flip();
                    decoder.decode(bytes, chars, false);
                    //keeps the incomplete trailing sequence at the start of the buffer
                    bytes.compact();
                    hand(chars);
                }
            }
        } catch (IOException e) {
            if (running.get()) {
                logger.warn("{} failed reading {}, closing session: {}", name, source.getName(), e.getMessage());
            } else {
                logger.debug("{} {} closed: {}", name, source.getName(), e.getMessage());
            }
            fail();
        } catch (InterruptedException e) {
            logger.debug("{} {} drainer interrupted", name, source.getName());
            Thread.currentThread().interrupt();
            fail();
        } finally {
            closeTrace();
            logger.debug("{} {} drainer is stopping", name, source.getName());
        }
    }

    private void hand(CharBuffer chars) throws InterruptedException {
        chars.flip();
        if(chars.hasRemaining()){
            queue.put(new Chunk(source, chars.toString()));
        }
        chars.clear();
    }

    private void fail(){
        if(onFailure != null){
            onFailure.run();
        }
    }

    private void trace(byte[] buffer, int offset, int length){
        if(trace != null){
            try {
                trace.write(buffer, offset, length);
                trace.flush();
            } catch (IOException e) {
                logger.error("{} failed to write {} trace, disabling trace", name, source.getName(), e);
                closeTrace();
            }
        }
    }
    private void closeTrace(){
        if(trace != null){
            OutputStream toClose = trace;
            trace = null;
            try {
                toClose.close();
            } catch (IOException e) {
                logger.error("{} error closing {} trace", name, source.getName(), e);
            }
        }
    }
}
