package com.questrail.mdoc.session;

import com.authlete.cbor.CBORPairList;
import com.questrail.mdoc.api.ProximityTransport;
import com.questrail.mdoc.api.TransportError;
import com.questrail.mdoc.api.TransportListener;
import com.questrail.mdoc.cbor.Cbor;
import com.questrail.mdoc.cbor.CborDecodeException;
import com.questrail.mdoc.cbor.SessionTranscript;
import com.questrail.mdoc.crypto.SessionCryptoEngine;
import com.questrail.mdoc.crypto.SessionCryptoException;
import com.questrail.mdoc.crypto.SessionRole;
import com.questrail.mdoc.crypto.cose.CoseKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyPair;
import java.security.interfaces.ECPublicKey;
import java.util.Objects;

/**
 * DeviceSession
 * =============================================================================
 * Device side of one mdoc session on top of a {@link ProximityTransport}.
 *
 * <p>The first message from the reader must be a SessionEstablishment. Its
 * EReaderKey completes the session transcript, which fixes the keys of the
 * {@link SessionCryptoEngine}; the enclosed request is then decrypted. Every
 * later message is SessionData.</p>
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>undecodable message: SessionData status 11, then disconnect</li>
 *   <li>authentication failure: SessionData status 10, then disconnect</li>
 *   <li>status 20 from the reader: session terminated, disconnect</li>
 * </ul>
 *
 * <p>All callbacks arrive on the transport's dispatch context, so the
 * session needs no locking of its own.</p>
 */
public final class DeviceSession implements TransportListener
{
    private static final Logger log = LoggerFactory.getLogger(DeviceSession.class);

    private final ProximityTransport transport;
    private final KeyPair eDeviceKey;
    private final byte[] deviceEngagement;
    private final byte[] handover;
    private final DeviceSessionListener listener;

    private SessionCryptoEngine engine;
    private boolean closed;

    /**
     * @param transport        connected or connecting transport; this session becomes its listener
     * @param eDeviceKey       the device's ephemeral key pair, as advertised in the engagement
     * @param deviceEngagement encoded DeviceEngagement
     * @param handover         encoded Handover, or {@code null} for QR engagement
     * @param listener         session callbacks
     */
    public DeviceSession(ProximityTransport transport,
                         KeyPair eDeviceKey,
                         byte[] deviceEngagement,
                         byte[] handover,
                         DeviceSessionListener listener)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.eDeviceKey = Objects.requireNonNull(eDeviceKey, "eDeviceKey");
        this.deviceEngagement = Objects.requireNonNull(deviceEngagement, "deviceEngagement").clone();
        this.handover = handover == null ? null : handover.clone();
        this.listener = Objects.requireNonNull(listener, "listener");

        transport.setListener(this);
    }

    /** {@code true} once a SessionEstablishment has been processed. */
    public boolean isEstablished() {
        return engine != null;
    }

    /**
     * Encrypts and sends a DeviceResponse.
     */
    public void sendResponse(byte[] deviceResponse) {
        Objects.requireNonNull(deviceResponse, "deviceResponse");
        if (engine == null) {
            throw new IllegalStateException("No SessionEstablishment received yet");
        }
        if (closed) {
            throw new IllegalStateException("Session closed");
        }
        transport.sendMessage(SessionData.ofData(engine.encryptToReader(deviceResponse)).encode());
    }

    /**
     * Ends the session. The transport-specific signal is used when requested
     * and available, otherwise SessionData status 20 is sent.
     */
    public void terminate(boolean preferTransportSpecific) {
        if (closed) {
            return;
        }
        if (preferTransportSpecific && transport.supportsTransportSpecificTermination()) {
            transport.sendTransportSpecificTermination();
        }
        else {
            transport.sendMessage(SessionData.ofStatus(SessionStatus.SESSION_TERMINATION).encode());
        }
        close();
    }

    // ---------------------------------------------------------------------
    // TransportListener
    // ---------------------------------------------------------------------

    @Override
    public void onPeerConnected() {
        listener.onPeerConnected();
    }

    @Override
    public void onMessageReceived(byte[] message) {
        if (closed) {
            return;
        }

        try {
            CBORPairList map = Cbor.asMap(Cbor.decode(message));
            if (engine == null) {
                establish(SessionEstablishment.fromMap(map));
                return;
            }
            handleSessionData(SessionData.fromMap(map));
        }
        catch (CborDecodeException e) {
            log.warn("Undecodable session message: {}", e.getMessage());
            fail(SessionStatus.CBOR_DECODING_ERROR, e);
        }
        catch (SessionCryptoException e) {
            log.warn("Session crypto failure ({}): {}", e.kind(), e.getMessage());
            fail(SessionStatus.SESSION_ENCRYPTION_ERROR, e);
        }
    }

    @Override
    public void onPeerDisconnected() {
        destroyKeys();
        listener.onPeerDisconnected();
    }

    @Override
    public void onTransportSpecificTermination() {
        listener.onSessionTerminated();
        close();
    }

    @Override
    public void onError(TransportError error) {
        destroyKeys();
        listener.onError(error.toException());
    }

    // ---------------------------------------------------------------------

    private void establish(SessionEstablishment establishment) {
        ECPublicKey eReaderKey = CoseKey.decode(establishment.eReaderKey());

        SessionCryptoEngine newEngine = new SessionCryptoEngine(SessionRole.DEVICE, eDeviceKey);
        newEngine.setPeerPublicKey(eReaderKey);
        newEngine.setSessionTranscript(
                SessionTranscript.of(deviceEngagement, establishment.eReaderKey(), handover));
        engine = newEngine;

        log.debug("Session established with reader key on {}", newEngine.curve());
        listener.onRequest(engine.decryptFromReader(establishment.data()));
    }

    private void handleSessionData(SessionData sessionData) {
        if (sessionData.data() != null) {
            listener.onRequest(engine.decryptFromReader(sessionData.data()));
        }
        if (sessionData.status() != null) {
            long status = sessionData.status();
            if (status == SessionStatus.SESSION_TERMINATION) {
                log.debug("Reader terminated the session");
                listener.onSessionTerminated();
                close();
            }
            else {
                log.warn("Reader reported session status {}", status);
            }
        }
    }

    private void fail(long status, RuntimeException cause) {
        transport.sendMessage(SessionData.ofStatus(status).encode());
        close();
        listener.onError(cause);
    }

    private void close() {
        closed = true;
        destroyKeys();
        transport.disconnect();
    }

    private void destroyKeys() {
        if (engine != null) {
            engine.destroy();
        }
    }
}
