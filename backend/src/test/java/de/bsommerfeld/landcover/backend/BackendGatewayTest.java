package de.bsommerfeld.landcover.backend;

import de.bsommerfeld.landcover.core.config.BackendConfig;
import de.bsommerfeld.landcover.core.error.BackendTimeoutException;
import de.bsommerfeld.landcover.core.error.BackendUnavailableException;
import de.bsommerfeld.landcover.core.error.EmptyRegionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackendGatewayTest {

    private BackendGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new BackendGateway(new BackendConfig());
    }

    @AfterEach
    void tearDown() {
        gateway.shutdown();
    }

    @Test
    void call_shouldReturnResultWithinTimeout() {
        assertEquals("ok", gateway.call("fast", () -> "ok", Duration.ofSeconds(5)));
    }

    @Test
    void call_shouldFailWithTimeoutWhenCallIsSlow() {
        BackendTimeoutException e = assertThrows(BackendTimeoutException.class,
                () -> gateway.call("slow", () -> {
                    Thread.sleep(5_000);
                    return "late";
                }, Duration.ofMillis(50)));

        assertTrue(e.getMessage().contains("slow"));
    }

    @Test
    void call_shouldRethrowDomainExceptionsUnchanged() {
        EmptyRegionException original = new EmptyRegionException("nothing here");

        EmptyRegionException thrown = assertThrows(EmptyRegionException.class,
                () -> gateway.call("sample", () -> {
                    throw original;
                }, Duration.ofSeconds(5)));

        assertSame(original, thrown);
    }

    @Test
    void call_shouldWrapOtherFailuresAsUnavailable() {
        BackendUnavailableException e = assertThrows(BackendUnavailableException.class,
                () -> gateway.call("io", () -> {
                    throw new IOException("connection reset");
                }, Duration.ofSeconds(5)));

        assertInstanceOf(IOException.class, e.getCause());
    }
}
