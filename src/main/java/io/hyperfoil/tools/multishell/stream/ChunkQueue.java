package io.hyperfoil.tools.multishell.stream;

import java.util.concurrent.LinkedTransferQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TransferQueue;

/**
 * Rendezvous hand-off between the stream drainers and the response collector.
 * <p>
 * {@link #put(Chunk)} blocks the drainer until the collector takes the chunk, so a drainer never gets
 * more than one chunk ahead of the collector. Chunks of both sources travel through the same queue and keep
 * their source tag.
 */
public class ChunkQueue {

    private final TransferQueue<Chunk> queue = new LinkedTransferQueue<>();

    /**
     * Waits until the chunk has been taken by {@link #poll(long, TimeUnit)}.
     */
    public void put(Chunk chunk) throws InterruptedException {
        queue.transfer(chunk);
    }

    public Chunk poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout,unit);
    }

    /**
     * @return true if a drainer for the source is currently waiting to hand off a chunk
     */
    public boolean hasPending(Chunk.Source source){
        return pendingCount(source) > 0;
    }

    public int pendingCount(Chunk.Source source){
        int rtrn = 0;
        for(Chunk chunk : queue){
            if(chunk.getSource().equals(source)){
                rtrn++;
            }
        }
        return rtrn;
    }

    public boolean isEmpty(){
        return queue.isEmpty();
    }
}
