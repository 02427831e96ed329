package io.streamwire.websocket.transport;

import java.io.IOException;

/**
 * Signals that a transport connection is closed, carrying the close code and who initiated it.
 */
public class TransportClosedException extends IOException {

    public static final int NORMAL_CLOSURE = 1000;
    public static final int ABNORMAL_CLOSURE = 1006;

    private final int code;
    private final String reason;
    private final boolean remote;

    public TransportClosedException(int code, String reason, boolean remote) {
        this(code, reason, remote, null);
    }

    public TransportClosedException(int code, String reason, boolean remote, Throwable cause) {
        super("Connection closed (code=" + code + ", reason=" + reason + ", remote=" + remote + ")", cause);
        this.code = code;
        this.reason = reason == null ? "" : reason;
        this.remote = remote;
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Returns true when the peer sent a close frame, false for local closes and dropped connections.
     */
    public boolean isRemote() {
        return remote;
    }
}
