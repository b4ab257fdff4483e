package com.wscrape.ssh;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Executes a fixed command through a fresh {@code exec} channel on a shared JSch session.
 *
 * <p>Each call opens its own channel and disconnects it before returning. The session itself is owned by
 * the caller and is never closed here.
 *
 * <p>Output only counts once the channel has closed with an exit status. A channel that ends because the
 * session dropped, or that does not close within the command timeout, fails the call.
 */
public class JschCommandExecutor implements RemoteCommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(JschCommandExecutor.class);

    public static final String STATUS_COMMAND = "w";

    static final long POLL_INTERVAL_MS = 10;
    private static final int NO_EXIT_STATUS = -1;

    private final Session session;
    private final String command;
    private final int connectTimeoutMs;
    private final long commandTimeoutMs;

    public JschCommandExecutor(Session session, int connectTimeoutMs, long commandTimeoutMs) {
        this(session, STATUS_COMMAND, connectTimeoutMs, commandTimeoutMs);
    }

    JschCommandExecutor(Session session, String command, int connectTimeoutMs, long commandTimeoutMs) {
        this.session = Objects.requireNonNull(session, "session");
        this.command = Objects.requireNonNull(command, "command");
        this.connectTimeoutMs = connectTimeoutMs;
        this.commandTimeoutMs = commandTimeoutMs;
    }

    @Override
    public String execute() throws RemoteCommandException {
        if (!session.isConnected()) {
            throw new RemoteCommandException("SSH session to " + session.getHost() + " is not connected");
        }

        ChannelExec channel = null;
        try {
            channel = (ChannelExec) session.openChannel("exec");
            channel.setCommand(command);
            channel.setInputStream(null);

            // The stream must be obtained before connect() or early output can be lost.
            InputStream stdout = channel.getInputStream();
            channel.connect(connectTimeoutMs);

            String output = readUntilClosed(channel, stdout);

            // Valid only after close; a dropped session closes the channel without one.
            int exitStatus = channel.getExitStatus();
            if (exitStatus == NO_EXIT_STATUS || !session.isConnected()) {
                throw new RemoteCommandException("SSH session to " + session.getHost()
                        + " ended before '" + command + "' completed");
            }
            if (exitStatus > 0) {
                log.warn("Remote command exited with status {}: host={}, command={}", exitStatus, session.getHost(), command);
            }
            return output;
        } catch (JSchException | IOException e) {
            throw new RemoteCommandException("Failed to run '" + command + "' on " + session.getHost(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCommandException("Interrupted while running '" + command + "' on " + session.getHost(), e);
        } finally {
            if (channel != null) {
                channel.disconnect();
            }
        }
    }

    private String readUntilClosed(ChannelExec channel, InputStream stdout)
            throws IOException, InterruptedException, RemoteCommandException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[4096];
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(commandTimeoutMs);

        while (true) {
            while (stdout.available() > 0) {
                int n = stdout.read(buffer, 0, buffer.length);
                if (n < 0) {
                    break;
                }
                out.write(buffer, 0, n);
            }
            if (channel.isClosed()) {
                if (stdout.available() > 0) {
                    continue;
                }
                break;
            }
            if (System.nanoTime() - deadline > 0) {
                throw new RemoteCommandException("'" + command + "' on " + session.getHost()
                        + " did not complete within " + commandTimeoutMs + " ms");
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }
        return out.toString(StandardCharsets.UTF_8);
    }
}
