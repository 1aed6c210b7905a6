package io.hyperfoil.tools.multishell;

import java.util.Objects;

/**
 * Connection information for a remote shell, parsed from {@code user[:password]@hostname[:port]}.
 */
public class Host {

    public static final int DEFAULT_PORT = 22;

    public static Host parse(String fullyQualified) {
        if(fullyQualified == null || fullyQualified.isBlank() || !fullyQualified.contains("@")){
            return null;
        }
        String password = null;
        String username = fullyQualified.substring(0, fullyQualified.lastIndexOf("@"));
        if(username.contains(":")){
            String tmpUsername = username.substring(0,username.indexOf(":"));
            password = username.substring(username.indexOf(":")+1);
            username = tmpUsername;
        }
        String hostname = fullyQualified.substring(fullyQualified.lastIndexOf("@") + 1);
        int port = DEFAULT_PORT;
        if (hostname.contains(":")) {
            try {
                port = Integer.parseInt(hostname.substring(hostname.indexOf(":") + 1));
            }catch(NumberFormatException e){
                return null;
            }
            hostname = hostname.substring(0, hostname.indexOf(":"));
        }
        if(username.isEmpty() || hostname.isEmpty()){
            return null;
        }
        return new Host(username, hostname, password, port);
    }

    private final String userName;
    private final String hostName;
    private final String password;
    private final int port;
    private String identity;
    private String passphrase;

    public Host(String userName, String hostName){
        this(userName,hostName,null,DEFAULT_PORT);
    }
    public Host(String userName, String hostName, String password, int port){
        this.userName = userName;
        this.hostName = hostName;
        this.password = password;
        this.port = port;
    }

    public String getUserName(){return userName;}
    public String getHostName(){return hostName;}
    public int getPort(){return port;}

    public boolean hasPassword(){return password != null && !password.isEmpty();}
    public String getPassword(){return password;}

    public boolean hasIdentity(){return identity != null && !identity.isEmpty();}
    public String getIdentity(){return identity;}
    public Host setIdentity(String identity){
        this.identity = identity;
        return this;
    }

    public boolean hasPassphrase(){return passphrase != null && !passphrase.isEmpty();}
    public String getPassphrase(){return passphrase;}
    public Host setPassphrase(String passphrase){
        this.passphrase = passphrase;
        return this;
    }

    /**
     * Registers the password and passphrase with the filter so they never reach the log.
     */
    public void addSecrets(SecretFilter filter){
        filter.addSecret(password);
        filter.addSecret(passphrase);
    }

    public String getSafeString(){
        return userName+"@"+hostName+":"+port;
    }

    @Override
    public String toString(){
        return getSafeString();
    }

    @Override
    public boolean equals(Object o){
        if(this == o){
            return true;
        }
        if(!(o instanceof Host)){
            return false;
        }
        Host host = (Host) o;
        return port == host.port && Objects.equals(userName, host.userName) && Objects.equals(hostName, host.hostName);
    }

    @Override
    public int hashCode(){
        return Objects.hash(userName,hostName,port);
    }
}
