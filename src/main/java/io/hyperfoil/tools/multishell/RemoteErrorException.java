package io.hyperfoil.tools.multishell;

import java.io.IOException;

/**
 * The shell wrote to the error stream while a command was running.
 * Carries whatever output was collected from the main stream.
 */
public class RemoteErrorException extends IOException {

    private final String command;
    private final String output;
    private final String error;

    public RemoteErrorException(String command, String output, String error){
        super(error);
        this.command = command;
        this.output = output;
        this.error = error;
    }

    public String getCommand(){return command;}
    public String getOutput(){return output;}
    public String getError(){return error;}
}
