package io.hyperfoil.tools.multishell.stream;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.Queue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class StreamDrainerTest {

    /**
     * Returns one segment per read then the end of the stream, or fails instead of the end of the stream.
     */
    private static class SegmentedStream extends InputStream {
        private final Queue<byte[]> segments = new LinkedList<>();
        private final boolean failAtEnd;
        private final AtomicInteger reads = new AtomicInteger();

        SegmentedStream(boolean failAtEnd, String...segments){
            this.failAtEnd = failAtEnd;
            Arrays.stream(segments).map(s->s.getBytes(StandardCharsets.UTF_8)).forEach(this.segments::add);
        }

        static SegmentedStream ofBytes(byte[]...segments){
            SegmentedStream rtrn = new SegmentedStream(false);
            rtrn.segments.addAll(Arrays.asList(segments));
            return rtrn;
        }

        @Override
        public int read() throws IOException {
            throw new UnsupportedOperationException("single byte read");
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            reads.incrementAndGet();
            byte[] next = segments.poll();
            if(next == null){
                if(failAtEnd){
                    throw new IOException("broken stream");
                }
                return -1;
            }
            System.arraycopy(next,0,b,off,next.length);
            return next.length;
        }
    }

    @Test(timeout = 10_000)
    public void chunk_perRead() throws InterruptedException {
        ChunkQueue queue = new ChunkQueue();
        CountDownLatch failed = new CountDownLatch(1);
        StreamDrainer drainer = new StreamDrainer("test", Chunk.Source.Output, new SegmentedStream(false,"abc","def"), queue, new AtomicBoolean(true), failed::countDown);
        Thread thread = new Thread(drainer);
        thread.start();

        Chunk first = queue.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertEquals("abc",first.getText());
        assertTrue(first.isOutput());
        Chunk second = queue.poll(5, TimeUnit.SECONDS);
        assertNotNull(second);
        assertEquals("reads should not be merged","def",second.getText());

        assertTrue("end of stream should invoke the failure callback",failed.await(5, TimeUnit.SECONDS));
        thread.join(5_000);
        assertFalse(thread.isAlive());
    }

    @Test(timeout = 10_000)
    public void readError_invokesFailure() throws InterruptedException {
        ChunkQueue queue = new ChunkQueue();
        CountDownLatch failed = new CountDownLatch(1);
        StreamDrainer drainer = new StreamDrainer("test", Chunk.Source.Error, new SegmentedStream(true,"oops"), queue, new AtomicBoolean(true), failed::countDown);
        Thread thread = new Thread(drainer);
        thread.start();

        Chunk chunk = queue.poll(5, TimeUnit.SECONDS);
        assertNotNull(chunk);
        assertTrue("chunk should be tagged as error",chunk.isError());
        assertTrue("read error should invoke the failure callback",failed.await(5, TimeUnit.SECONDS));
    }

    @Test(timeout = 10_000)
    public void splitCharacter_decodedWithNextRead() throws InterruptedException {
        ChunkQueue queue = new ChunkQueue();
        CountDownLatch failed = new CountDownLatch(1);
        SegmentedStream stream = SegmentedStream.ofBytes(
                new byte[]{'c','a','f',(byte)0xC3},
                new byte[]{(byte)0xA9,'!'}
        );
        StreamDrainer drainer = new StreamDrainer("test", Chunk.Source.Output, stream, queue, new AtomicBoolean(true), failed::countDown);
        Thread thread = new Thread(drainer);
        thread.start();

        Chunk first = queue.poll(5, TimeUnit.SECONDS);
        assertNotNull(first);
        assertEquals("caf",first.getText());
        Chunk second = queue.poll(5, TimeUnit.SECONDS);
        assertNotNull(second);
        assertEquals("\u00e9!",second.getText());
        assertEquals("caf\u00e9!",first.getText()+second.getText());
        assertTrue(failed.await(5, TimeUnit.SECONDS));
    }

    @Test(timeout = 10_000)
    public void incompleteCharacter_onlyRead_noChunk() throws InterruptedException {
        ChunkQueue queue = new ChunkQueue();
        CountDownLatch failed = new CountDownLatch(1);
        SegmentedStream stream = SegmentedStream.ofBytes(
                new byte[]{(byte)0xE2,(byte)0x82},
                new byte[]{(byte)0xAC}
        );
        StreamDrainer drainer = new StreamDrainer("test", Chunk.Source.Output, stream, queue, new AtomicBoolean(true), failed::countDown);
        Thread thread = new Thread(drainer);
        thread.start();

        Chunk chunk = queue.poll(5, TimeUnit.SECONDS);
        assertNotNull(chunk);
        assertEquals("euro sign is complete after the second read","\u20ac",chunk.getText());
        assertTrue(failed.await(5, TimeUnit.SECONDS));
        assertNull(queue.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void notRunning_doesNotRead(){
        ChunkQueue queue = new ChunkQueue();
        AtomicInteger failures = new AtomicInteger();
        SegmentedStream stream = new SegmentedStream(false,"abc");
        StreamDrainer drainer = new StreamDrainer("test", Chunk.Source.Output, stream, queue, new AtomicBoolean(false), failures::incrementAndGet);
        drainer.run();
        assertEquals("should not read when stopped",0,stream.reads.get());
        assertEquals("stopping is not a failure",0,failures.get());
        assertTrue(queue.isEmpty());
    }

    @Test(timeout = 10_000)
    public void interrupted_whileHandingOff() throws InterruptedException {
        ChunkQueue queue = new ChunkQueue();
        CountDownLatch failed = new CountDownLatch(1);
        StreamDrainer drainer = new StreamDrainer("test", Chunk.Source.Output, new SegmentedStream(false,"nobody reads this"), queue, new AtomicBoolean(true), failed::countDown);
        Thread thread = new Thread(drainer);
        thread.start();
        while(!queue.hasPending(Chunk.Source.Output)){
            Thread.sleep(5);
        }
        thread.interrupt();
        assertTrue("interrupt should invoke the failure callback",failed.await(5, TimeUnit.SECONDS));
        thread.join(5_000);
        assertFalse(thread.isAlive());
        assertNull("chunk should not be delivered after the interrupt",queue.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test(timeout = 10_000)
    public void trace_copiesRawBytes() throws InterruptedException {
        ChunkQueue queue = new ChunkQueue();
        CountDownLatch failed = new CountDownLatch(1);
        ByteArrayOutputStream trace = new ByteArrayOutputStream();
        StreamDrainer drainer = new StreamDrainer("test", Chunk.Source.Output, new SegmentedStream(false,"one","two"), queue, new AtomicBoolean(true), failed::countDown);
        drainer.setTrace(trace);
        assertTrue(drainer.hasTrace());
        Thread thread = new Thread(drainer);
        thread.start();
        queue.poll(5, TimeUnit.SECONDS);
        queue.poll(5, TimeUnit.SECONDS);
        assertTrue(failed.await(5, TimeUnit.SECONDS));
        thread.join(5_000);
        assertEquals("onetwo",trace.toString());
        assertFalse("trace is closed when the drainer stops",drainer.hasTrace());
    }
}
