package io.hyperfoil.tools.multishell.stream;

import java.util.List;

/**
 * Checks accumulated shell output against a set of terminators. Any matching terminator is enough.
 */
public final class TerminatorMatcher {

    private TerminatorMatcher(){}

    public static boolean matches(String text, List<Terminator> terminators){
        if(text == null || terminators == null){
            return false;
        }
        for(Terminator terminator : terminators){
            if(terminator != null && terminator.matches(text)){
                return true;
            }
        }
        return false;
    }

    public static boolean matches(String text, String...patterns){
        return matches(text, Terminator.parse(patterns));
    }
}
