package io.hyperfoil.tools.multishell.shell;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Hands out the program input before the program is started. Writes fail until a target is set.
 */
public class DeferredOutputStream extends OutputStream {

    private final String name;
    private volatile OutputStream target;
    private volatile boolean closed = false;

    public DeferredOutputStream(String name){
        this.name = name;
    }

    public void setTarget(OutputStream target){
        this.target = target;
    }
    public boolean hasTarget(){return target != null;}

    private OutputStream target() throws IOException {
        if(closed){
            throw new IOException(name+" input is closed");
        }
        OutputStream rtrn = target;
        if(rtrn == null){
            throw new IOException(name+" is not started");
        }
        return rtrn;
    }

    @Override
    public void write(int b) throws IOException {
        target().write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        target().write(b,off,len);
    }

    @Override
    public void flush() throws IOException {
        target().flush();
    }

    @Override
    public void close() throws IOException {
        if(closed){
            return;
        }
        closed = true;
        OutputStream toClose = target;
        if(toClose != null){
            toClose.close();
        }
    }
}
