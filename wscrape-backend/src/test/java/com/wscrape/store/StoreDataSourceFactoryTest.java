package com.wscrape.store;

import com.wscrape.config.ConfigurationException;
import com.wscrape.config.Login;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreDataSourceFactoryTest {

    private final StoreDataSourceFactory factory = new StoreDataSourceFactory();
    private final Login login = new Login("dbuser", "dbpass");

    @Test
    void open_BlankUrl_ThrowsConfigurationException() {
        assertThatThrownBy(() -> factory.open("", login)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void open_UnknownDriver_ThrowsConfigurationException() {
        assertThatThrownBy(() -> factory.open("jdbc:nosuchdriver://localhost/wscrape", login))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("jdbc:nosuchdriver://localhost/wscrape");
    }

    @Test
    void open_UnreachableStore_ThrowsConfigurationException() {
        // nothing listens on port 1
        assertThatThrownBy(() -> factory.open("jdbc:mariadb://127.0.0.1:1/wscrape?connectTimeout=500", login))
                .isInstanceOf(ConfigurationException.class);
    }
}
