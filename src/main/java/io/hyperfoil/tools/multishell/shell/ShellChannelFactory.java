package io.hyperfoil.tools.multishell.shell;

import io.hyperfoil.tools.multishell.SecretFilter;

import java.io.IOException;

/**
 * Creates channels on an already connected and authenticated transport.
 */
@FunctionalInterface
public interface ShellChannelFactory {

    RemoteShellChannel openChannel() throws IOException;

    /**
     * Registers the credentials used by the transport so sessions mask them in their logs.
     */
    default void addSecrets(SecretFilter filter){}
}
