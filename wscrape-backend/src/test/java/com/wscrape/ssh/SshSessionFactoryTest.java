package com.wscrape.ssh;

import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.wscrape.config.ConfigurationException;
import com.wscrape.config.Login;
import com.wscrape.config.WScrapeProperties;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SshSessionFactoryTest {

    private static final Login LOGIN = new Login("sshuser", "sshpass");

    private static WScrapeProperties properties(String host) {
        return WScrapeProperties.builder()
                .sshHost(host)
                .captureIntervalMs(1_000)
                .sshConnectTimeoutMs(3_000)
                .sshServerAliveIntervalMs(5_000)
                .sshServerAliveCountMax(2)
                .build();
    }

    @Test
    void open_ConnectsOnPort22WithPassword() throws JSchException {
        JSch jsch = mock(JSch.class);
        Session session = mock(Session.class);
        when(jsch.getSession("sshuser", "example.org", 22)).thenReturn(session);

        Session opened = new SshSessionFactory(jsch).open(LOGIN, properties("example.org"));

        assertThat(opened).isSameAs(session);
        verify(session).setPassword("sshpass");
        verify(session).setConfig(any(Properties.class));
        verify(session).connect(3_000);
    }

    @Test
    void open_EnablesKeepalivesBeforeConnecting() throws JSchException {
        JSch jsch = mock(JSch.class);
        Session session = mock(Session.class);
        when(jsch.getSession("sshuser", "example.org", 22)).thenReturn(session);

        new SshSessionFactory(jsch).open(LOGIN, properties("example.org"));

        InOrder inOrder = inOrder(session);
        inOrder.verify(session).setServerAliveInterval(5_000);
        inOrder.verify(session).connect(3_000);
        verify(session).setServerAliveCountMax(2);
    }

    @Test
    void open_DefaultKeepalivesAreEnabled() {
        WScrapeProperties defaults = WScrapeProperties.builder().sshHost("example.org").build();

        assertThat(defaults.getSshServerAliveIntervalMs()).isPositive();
        assertThat(defaults.getSshServerAliveCountMax()).isPositive();
        assertThat(defaults.getCommandTimeoutMs()).isPositive();
    }

    @Test
    void open_AuthFailure_ThrowsConfigurationException() throws JSchException {
        JSch jsch = mock(JSch.class);
        Session session = mock(Session.class);
        when(jsch.getSession("sshuser", "example.org", 22)).thenReturn(session);
        doThrow(new JSchException("Auth fail")).when(session).connect(anyInt());

        assertThatThrownBy(() -> new SshSessionFactory(jsch).open(LOGIN, properties("example.org")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("example.org")
                .hasCauseInstanceOf(JSchException.class);
    }

    @Test
    void open_BlankHost_ThrowsConfigurationException() {
        assertThatThrownBy(() -> new SshSessionFactory(mock(JSch.class)).open(LOGIN, properties(" ")))
                .isInstanceOf(ConfigurationException.class);
    }
}
