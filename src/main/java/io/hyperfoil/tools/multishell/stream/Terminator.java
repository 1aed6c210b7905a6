package io.hyperfoil.tools.multishell.stream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A pattern that marks the end of a response from the shell.
 * <p>
 * Callers pass terminators as strings: a leading {@code ^} anchors the rest of the pattern to the start of the
 * accumulated text, a trailing {@code $} anchors the pattern before it to the end and anything else matches
 * anywhere in the text. The two anchors are tested independently, {@code ^foo$} matches text that starts with
 * {@code foo$} or ends with {@code ^foo}. A bare {@code $} or {@code ^} anchors an empty pattern and matches any text.
 */
public class Terminator {

    public static final String PREFIX_MARKER = "^";
    public static final String SUFFIX_MARKER = "$";

    public enum Kind {
        Prefix,
        Suffix,
        Contains
    }

    public static Terminator prefix(String text){
        return new Terminator(Kind.Prefix,text);
    }
    public static Terminator suffix(String text){
        return new Terminator(Kind.Suffix,text);
    }
    public static Terminator contains(String text){
        return new Terminator(Kind.Contains,text);
    }

    /**
     * Parses one terminator string into the tests it stands for, empty for null or empty patterns.
     */
    public static List<Terminator> parsePattern(String pattern){
        if(pattern == null || pattern.isEmpty()){
            return Collections.emptyList();
        }
        boolean anchorStart = pattern.startsWith(PREFIX_MARKER);
        boolean anchorEnd = pattern.endsWith(SUFFIX_MARKER);
        if(!anchorStart && !anchorEnd){
            return Collections.singletonList(contains(pattern));
        }
        List<Terminator> rtrn = new ArrayList<>(2);
        if(anchorStart){
            rtrn.add(prefix(pattern.substring(PREFIX_MARKER.length())));
        }
        if(anchorEnd){
            rtrn.add(suffix(pattern.substring(0,pattern.length()-SUFFIX_MARKER.length())));
        }
        return rtrn;
    }

    public static List<Terminator> parse(String...patterns){
        if(patterns == null || patterns.length == 0){
            return Collections.emptyList();
        }
        List<Terminator> rtrn = new ArrayList<>(patterns.length);
        for(String pattern : patterns){
            rtrn.addAll(parsePattern(pattern));
        }
        return rtrn;
    }

    private final Kind kind;
    private final String text;

    private Terminator(Kind kind, String text){
        this.kind = Objects.requireNonNull(kind);
        this.text = text == null ? "" : text;
    }

    public Kind getKind(){return kind;}
    public String getText(){return text;}

    public boolean matches(String source){
        if(source == null){
            return false;
        }
        switch (kind){
            case Prefix:
                return source.startsWith(text);
            case Suffix:
                return source.endsWith(text);
            default:
                return !text.isEmpty() && source.contains(text);
        }
    }

    @Override
    public boolean equals(Object o){
        if(this == o){
            return true;
        }
        if(!(o instanceof Terminator)){
            return false;
        }
        Terminator that = (Terminator) o;
        return kind == that.kind && text.equals(that.text);
    }

    @Override
    public int hashCode(){
        return Objects.hash(kind,text);
    }

    @Override
    public String toString(){
        switch (kind){
            case Prefix:
                return PREFIX_MARKER+text;
            case Suffix:
                return text+SUFFIX_MARKER;
            default:
                return text;
        }
    }
}
