package com.mikov.emailverifier.smtp.core;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;

/**
 * A single plain-text SMTP connection owned by one probe session.
 * Closing it sends a best-effort QUIT (unless one was already sent) and releases the socket.
 */
@Slf4j
public class SmtpConnection implements AutoCloseable {
    private static final String QUIT = "QUIT";

    private final String host;
    private final Socket socket;
    private final BufferedReader in;
    private final Writer out;
    private boolean quitSent;

    SmtpConnection(String host, Socket socket) throws IOException {
        this.host = host;
        this.socket = socket;
        this.in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
        this.out = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.US_ASCII);
    }

    public static SmtpConnection open(String host, int port, int connectTimeout) throws IOException {
        log.debug("Connecting to SMTP server {}:{}", host, port);
        final var socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), connectTimeout);
            return new SmtpConnection(host, socket);
        } catch (IOException e) {
            closeQuietly(socket);
            throw e;
        }
    }

    public void setReadTimeout(int timeout) throws SocketException {
        socket.setSoTimeout(timeout);
    }

    /**
     * Reads one reply, skipping {@code NNN-} continuation lines.
     *
     * @return the final line of the reply, or null once the server closed the stream
     */
    public SmtpResponse readResponse() throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            log.debug("{} <<< {}", host, line);
            if (line.length() < 4 || line.charAt(3) != '-') {
                return new SmtpResponse(line);
            }
        }
        return null;
    }

    public void sendCommand(String command) throws IOException {
        log.debug("{} >>> {}", host, command);
        out.write(command + "\r\n");
        out.flush();
        if (QUIT.equals(command)) {
            quitSent = true;
        }
    }

    @Override
    public void close() {
        if (!quitSent && !socket.isClosed()) {
            try {
                sendCommand(QUIT);
            } catch (IOException e) {
                log.debug("Error sending QUIT command to {}: {}", host, e.getMessage());
            }
        }
        closeQuietly(socket);
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
