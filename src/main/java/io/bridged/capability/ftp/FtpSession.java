package io.bridged.capability.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

final class FtpSession implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(FtpSession.class);

    private final FTPClient client;
    private final String host;
    private final int port;
    private volatile boolean loggedIn;
    private volatile String transferMode = "ascii";
    private String lastMessage = "";

    FtpSession(FTPClient client, String host, int port) {
        this.client = client;
        this.host = host;
        this.port = port;
        recordReply();
    }

    FTPClient client() {
        return client;
    }

    String host() {
        return host;
    }

    int port() {
        return port;
    }

    String state() {
        return loggedIn ? "logged_in" : "connected";
    }

    boolean loggedIn() {
        return loggedIn;
    }

    void markLoggedIn() {
        this.loggedIn = true;
    }

    String transferMode() {
        return transferMode;
    }

    void transferMode(String mode) {
        this.transferMode = mode;
    }

    String lastMessage() {
        return lastMessage;
    }

    String recordReply() {
        String reply = client.getReplyString();
        lastMessage = reply == null ? "" : reply.trim();
        return lastMessage;
    }

    @Override
    public void close() throws IOException {
        if (!client.isConnected()) {
            return;
        }
        try {
            if (loggedIn) {
                client.logout();
            }
        } catch (IOException e) {
            LOG.debug("FTP logout from {} failed: {}", host, e.getMessage());
        } finally {
            client.disconnect();
        }
    }
}
