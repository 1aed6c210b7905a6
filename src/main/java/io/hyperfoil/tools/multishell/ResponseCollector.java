package io.hyperfoil.tools.multishell;

import io.hyperfoil.tools.multishell.stream.Chunk;
import io.hyperfoil.tools.multishell.stream.ChunkQueue;
import io.hyperfoil.tools.multishell.stream.Terminator;
import io.hyperfoil.tools.multishell.stream.TerminatorMatcher;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Collects chunks from both shell streams until a terminator matches or the time budget runs out.
 * <p>
 * A terminator only ends the response when no other chunk from the same stream is waiting to be handed off,
 * this avoids stopping in the middle of a burst of output.
 */
public class ResponseCollector {

    final static XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final int DEFAULT_TIMEOUT_MS = 5_000;
    public static final String LINE_BREAK = "\r\n";

    /**
     * Used before the prompt is known, matches the end of common user and root prompts.
     */
    public static final List<Terminator> FALLBACK_TERMINATORS = Collections.unmodifiableList(Arrays.asList(
            Terminator.suffix("$ "),
            Terminator.suffix("# ")
    ));

    private final String name;
    private final ChunkQueue queue;
    private final Supplier<String> shellPrompt;
    private final int defaultTimeout;

    public ResponseCollector(String name, ChunkQueue queue, Supplier<String> shellPrompt){
        this(name,queue,shellPrompt,DEFAULT_TIMEOUT_MS);
    }
    public ResponseCollector(String name, ChunkQueue queue, Supplier<String> shellPrompt, int defaultTimeout){
        this.name = name;
        this.queue = queue;
        this.shellPrompt = shellPrompt;
        this.defaultTimeout = defaultTimeout > 0 ? defaultTimeout : DEFAULT_TIMEOUT_MS;
    }

    public int getDefaultTimeout(){return defaultTimeout;}

    List<Terminator> resolveTerminators(List<Terminator> terminators){
        if(terminators != null && !terminators.isEmpty()){
            return terminators;
        }
        String prompt = getPrompt();
        if(prompt.isEmpty()){
            return FALLBACK_TERMINATORS;
        }
        return Collections.singletonList(Terminator.suffix(prompt));
    }

    private String getPrompt(){
        String prompt = shellPrompt == null ? null : shellPrompt.get();
        return prompt == null ? "" : prompt;
    }

    public Response read(int timeoutMs, String...terminators){
        return read(timeoutMs, Terminator.parse(terminators));
    }

    public Response read(int timeoutMs, List<Terminator> terminators){
        if(timeoutMs <= 0){
            timeoutMs = defaultTimeout;
        }
        List<Terminator> resolved = resolveTerminators(terminators);
        StringBuilder output = new StringBuilder();
        StringBuilder error = new StringBuilder();
        boolean received = false;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        boolean polled = false;
        while(true){
            long remaining = deadline - System.nanoTime();
            if(remaining <= 0 && polled){
                logger.trace("{} read timed out after {}ms", name, timeoutMs);
                break;
            }
            polled = true;
            Chunk chunk;
            try {
                //always poll once so a chunk that is already waiting is not missed by a short budget
                chunk = queue.poll(Math.max(remaining,0), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                logger.debug("{} interrupted while waiting for a response", name);
                Thread.currentThread().interrupt();
                break;
            }
            if(chunk == null){
                logger.trace("{} read timed out after {}ms", name, timeoutMs);
                break;
            }
            received = true;
            StringBuilder target = chunk.isOutput() ? output : error;
            target.append(chunk.getText());
            if(TerminatorMatcher.matches(target.toString(), resolved) && !queue.hasPending(chunk.getSource())){
                logger.trace("{} {} matched terminator", name, chunk.getSource().getName());
                break;
            }
        }
        return new Response(trimPrompt(output.toString()), error.toString(), received);
    }

    /**
     * Removes the prompt the shell echoes after the command output, the line break before the prompt
     * can be {@code \r\n} or {@code \n}. Output that is only the prompt, as the reply to an empty command,
     * becomes the prompt itself.
     */
    String trimPrompt(String output){
        String prompt = getPrompt();
        if(output.isEmpty() || prompt.isEmpty()){
            return output;
        }
        int index = output.lastIndexOf(LINE_BREAK + prompt);
        if(index < 0){
            index = output.lastIndexOf("\n" + prompt);
        }
        if(index > 0){
            return output.substring(0,index);
        }
        if(index == 0){
            return stripLeadingLineBreaks(output);
        }
        return output;
    }

    public static String stripLeadingLineBreaks(String text){
        int start = 0;
        while(start < text.length() && (text.charAt(start) == '\r' || text.charAt(start) == '\n')){
            start++;
        }
        return text.substring(start);
    }

    /**
     * Reads and discards responses until nothing arrives within a minimal budget.
     * Removes output left from the previous command, banners or motd chatter.
     */
    public void drain(){
        int discarded = 0;
        Response response;
        do {
            response = read(1, Collections.emptyList());
            if(response.isReceived()){
                discarded++;
            }
        } while(response.isReceived() && !Thread.currentThread().isInterrupted());
        if(discarded > 0){
            logger.trace("{} discarded {} stale responses", name, discarded);
        }
    }
}
