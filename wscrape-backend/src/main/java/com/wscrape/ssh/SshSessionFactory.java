package com.wscrape.ssh;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.wscrape.config.ConfigurationException;
import com.wscrape.config.Login;
import com.wscrape.config.WScrapeProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Properties;

/**
 * Opens password-authenticated SSH sessions on port 22.
 */
@Slf4j
public class SshSessionFactory {

    public static final int SSH_PORT = 22;

    private final JSch jsch;

    public SshSessionFactory() {
        this(new JSch());
    }

    public SshSessionFactory(JSch jsch) {
        this.jsch = jsch;
    }

    /**
     * Connect to a host.
     *
     * <p>Keepalives are enabled so that a peer that vanishes without closing the connection is detected
     * and the session torn down instead of leaving channel reads waiting forever.
     *
     * @param login SSH credentials
     * @param properties host, connect timeout and keepalive settings
     * @return connected session
     * @throws ConfigurationException if the host cannot be reached or rejects the credentials
     */
    public Session open(Login login, WScrapeProperties properties) {
        String host = properties.getSshHost();
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("SSH host is required");
        }

        try {
            Session session = jsch.getSession(login.getUser(), host, SSH_PORT);
            Properties config = new Properties();
            config.put("StrictHostKeyChecking", "no");
            session.setConfig(config);
            session.setPassword(login.getPass());
            session.setServerAliveInterval(properties.getSshServerAliveIntervalMs());
            session.setServerAliveCountMax(properties.getSshServerAliveCountMax());
            session.connect(properties.getSshConnectTimeoutMs());
            log.info("Connected SSH session: host={}, user={}", host, login.getUser());
            return session;
        } catch (JSchException e) {
            throw new ConfigurationException("Failed to open SSH session to " + host + ": " + e.getMessage(), e);
        }
    }
}
