package io.bridged.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.bridged.model.BridgeRequest;
import io.bridged.model.BridgeResponse;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;

/**
 * Minimal client for the bridge socket, used by the CLI and by tests.
 */
public final class BridgeClient {
    private final Path socketPath;

    public BridgeClient(Path socketPath) {
        this.socketPath = socketPath;
    }

    public BridgeResponse call(String module, String function, ObjectNode params) throws IOException {
        BridgeRequest request = new BridgeRequest(module, function, params, System.currentTimeMillis() / 1000.0d);
        return RequestCodec.decodeResponse(exchange(RequestCodec.encode(request)));
    }

    public byte[] exchange(byte[] payload) throws IOException {
        try (SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            channel.connect(UnixDomainSocketAddress.of(socketPath));
            ByteBuffer out = ByteBuffer.wrap(payload);
            while (out.hasRemaining()) {
                channel.write(out);
            }
            channel.shutdownOutput();
            ByteArrayOutputStream response = new ByteArrayOutputStream();
            ByteBuffer in = ByteBuffer.allocate(8192);
            while (true) {
                in.clear();
                int n = channel.read(in);
                if (n < 0) {
                    break;
                }
                response.write(in.array(), 0, n);
            }
            return response.toByteArray();
        }
    }
}
