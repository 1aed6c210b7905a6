package io.hyperfoil.tools.multishell;

/**
 * Output collected for one command along with anything the shell wrote to the error stream.
 */
public class Response {

    private final String output;
    private final String error;
    private final boolean received;

    public Response(String output, String error, boolean received){
        this.output = output == null ? "" : output;
        this.error = error == null ? "" : error;
        this.received = received;
    }

    public String getOutput(){return output;}

    /**
     * @return text from the error stream, empty when there was none
     */
    public String getError(){return error;}
    public boolean hasError(){return !error.isEmpty();}

    /**
     * @return true if at least one chunk arrived, even if it was later trimmed away as the prompt echo
     */
    public boolean isReceived(){return received;}

    public RemoteErrorException toException(String command){
        return new RemoteErrorException(command,output,error);
    }

    @Override
    public String toString(){
        return "output="+output+(hasError() ? " error="+error : "");
    }
}
