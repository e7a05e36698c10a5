package de.bsommerfeld.channelstore.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    private String original;

    @BeforeEach
    void rememberProperty() {
        original = System.getProperty("app.mode");
    }

    @AfterEach
    void restoreProperty() {
        if (original != null)
            System.setProperty("app.mode", original);
        else
            System.clearProperty("app.mode");
    }

    @Test
    void get_shouldResolveFromSystemProperty() {
        System.setProperty("app.mode", "TEST");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldBeCaseInsensitive() {
        System.setProperty("app.mode", "test");
        assertEquals(ApplicationMode.TEST, ApplicationMode.get());
    }

    @Test
    void get_shouldDefaultToProdForInvalidValue() {
        System.setProperty("app.mode", "STAGING");
        assertEquals(ApplicationMode.PROD, ApplicationMode.get());
    }

    @Test
    void get_shouldNeverReturnNull() {
        System.clearProperty("app.mode");
        // APP_MODE may be set in the environment, either way a mode comes back
        assertNotNull(ApplicationMode.get());
    }

    @Test
    void isInMemory_shouldOnlyHoldForTestMode() {
        assertTrue(ApplicationMode.TEST.isInMemory());
        assertFalse(ApplicationMode.PROD.isInMemory());
    }
}
