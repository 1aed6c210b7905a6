package io.hyperfoil.tools.multishell.stream;

/**
 * Text decoded from a single read of one of the shell streams.
 */
public class Chunk {

    public enum Source {
        Output("stdout"),
        Error("stderr");

        private final String name;
        Source(String name){
            this.name = name;
        }
        public String getName(){return name;}
    }

    private final Source source;
    private final String text;

    public Chunk(Source source, String text){
        this.source = source;
        this.text = text;
    }

    public Source getSource(){return source;}
    public String getText(){return text;}
    public boolean isOutput(){return Source.Output.equals(source);}
    public boolean isError(){return Source.Error.equals(source);}

    @Override
    public String toString(){
        return source.getName()+"["+text.length()+"]";
    }
}
