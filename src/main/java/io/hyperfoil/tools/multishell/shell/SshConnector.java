package io.hyperfoil.tools.multishell.shell;

import io.hyperfoil.tools.multishell.Host;
import io.hyperfoil.tools.multishell.SecretFilter;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.future.ConnectFuture;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.session.Session;
import org.apache.sshd.common.session.SessionContext;
import org.apache.sshd.common.session.SessionListener;
import org.apache.sshd.common.util.GenericUtils;
import org.apache.sshd.common.util.io.resource.URLResource;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.apache.sshd.core.CoreModuleProperties;
import org.slf4j.ext.XLogger;
import org.slf4j.ext.XLoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connects and authenticates an ssh client session then opens {@link SshShellChannel}s on it.
 * Any server key is accepted.
 */
public class SshConnector implements ShellChannelFactory, Closeable {

    final static XLogger logger = XLoggerFactory.getXLogger(MethodHandles.lookup().lookupClass());

    public static final long DEFAULT_TIMEOUT = 10_000;

    private final Host host;
    private final long timeout;
    private final SecretFilter filter = new SecretFilter();
    private final AtomicInteger channelCounter = new AtomicInteger();
    private SshClient sshClient;
    private ClientSession clientSession;

    public SshConnector(Host host){
        this(host,DEFAULT_TIMEOUT);
    }
    public SshConnector(Host host, long timeout){
        this.host = host;
        this.timeout = timeout;
        host.addSecrets(filter);
    }

    public Host getHost(){return host;}

    public String getName(){return host.getSafeString();}

    @Override
    public void addSecrets(SecretFilter sessionFilter){
        sessionFilter.loadSecrets(filter);
    }

    public SshConnector connect() throws IOException {
        if(isOpen()){
            return this;
        }
        close();
        sshClient = SshClient.setUpDefaultClient();
        sshClient.addSessionListener(new SessionListener() {
            @Override
            public void sessionEstablished(Session session) {
                logger.debug("{} client established", getName());
            }

            @Override
            public void sessionDisconnect(Session session, int reason, String msg, String language, boolean initiator) {
                logger.debug("{} client disconnected: {}", getName(), msg);
            }

            @Override
            public void sessionClosed(Session session) {
                logger.debug("{} client closed", getName());
            }
        });
        CoreModuleProperties.IDLE_TIMEOUT.set(sshClient, Duration.ofSeconds(7*24*3600));
        CoreModuleProperties.NIO2_READ_TIMEOUT.set(sshClient, Duration.ofSeconds(7*24*3600));
        sshClient.setServerKeyVerifier((session, remoteAddress, serverKey) -> {
            logger.trace("{} accept server key for {}", getName(), remoteAddress);
            return true;
        });
        if(host.hasPassphrase()){
            sshClient.setFilePasswordProvider((SessionContext sessionContext, NamedResource namedResource, int i) -> host.getPassphrase());
        }
        sshClient.start();
        try {
            ConnectFuture future = sshClient.connect(host.getUserName(), host.getHostName(), host.getPort());
            clientSession = future.verify(timeout).getSession();
            if (host.hasIdentity()) {
                clientSession.addPublicKeyIdentity(loadIdentity());
            }
            if (host.hasPassword()) {
                logger.trace("{} adding password identity", getName());
                clientSession.addPasswordIdentity(host.getPassword());
            }
            logger.trace("{} authenticating client session", getName());
            clientSession.auth().verify(timeout);
        }catch(IOException e){
            close();
            throw new IOException("failed to connect to "+getName()+": "+filter.filter(e.getMessage()), e);
        }
        logger.debug("{} connected", getName());
        return this;
    }

    private KeyPair loadIdentity() throws IOException {
        URLResource urlResource = new URLResource(Paths.get(host.getIdentity()).toUri().toURL());
        try (InputStream inputStream = urlResource.openInputStream()) {
            Iterable<KeyPair> keyPairs = SecurityUtils.loadKeyPairIdentities(
                    clientSession,
                    urlResource,
                    inputStream,
                    (session, resourceKey, retryIndex) -> host.getPassphrase()
            );
            KeyPair keyPair = GenericUtils.head(keyPairs);
            if (keyPair == null) {
                throw new IOException("no key pair in " + host.getIdentity() + (host.hasPassphrase() ? " using the provided passphrase" : " without a passphrase"));
            }
            return keyPair;
        } catch (GeneralSecurityException e) {
            throw new IOException("failed to load identity " + host.getIdentity(), e);
        }
    }

    public boolean isOpen(){
        return sshClient != null && sshClient.isStarted() && clientSession != null && clientSession.isOpen();
    }

    @Override
    public RemoteShellChannel openChannel() throws IOException {
        if(!isOpen()){
            throw new IOException(getName()+" is not connected");
        }
        return new SshShellChannel(getName()+"#"+channelCounter.incrementAndGet(), clientSession, timeout);
    }

    @Override
    public void close() {
        try {
            if (clientSession != null && clientSession.isOpen()) {
                clientSession.close();
            }
        } catch (IOException e) {
            logger.error("{} error while closing session {}", getName(), filter.filter(e.getMessage()), e);
        } finally {
            clientSession = null;
            if (sshClient != null && sshClient.isStarted()) {
                sshClient.stop();
            }
            sshClient = null;
        }
    }
}
