package lab.relay.auth;

import java.security.SignatureException;

/**
 * Recovers the identity that produced a signature over a message.
 */
public interface SignatureRecovery {

    String recover(byte[] message, byte[] signature) throws SignatureException;
}
