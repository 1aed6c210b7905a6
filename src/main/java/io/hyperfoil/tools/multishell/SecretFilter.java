package io.hyperfoil.tools.multishell;

import java.util.Collections;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * Masks host passwords, key passphrases and other secrets before commands, hosts or errors reach the log.
 * Longer secrets are replaced first so a secret that contains another one is masked as a whole.
 */
public class SecretFilter {

    public static final String REPLACEMENT = "********";

    private static final Comparator<String> LONGEST_FIRST = Comparator.comparingInt(String::length).reversed()
            .thenComparing(Comparator.naturalOrder());

    private final Set<String> secrets = new TreeSet<>(LONGEST_FIRST);

    public void addSecret(String secret){
        if(secret != null && !secret.isEmpty()){
            secrets.add(secret);
        }
    }

    public void loadSecrets(SecretFilter filter){
        if(filter != null){
            secrets.addAll(filter.secrets);
        }
    }

    public String filter(String text){
        if(text == null || secrets.isEmpty()){
            return text;
        }
        String rtrn = text;
        for(String secret : secrets){
            rtrn = rtrn.replace(secret, REPLACEMENT);
        }
        return rtrn;
    }

    public Set<String> getSecrets(){return Collections.unmodifiableSet(secrets);}
    public int size(){return secrets.size();}
}
