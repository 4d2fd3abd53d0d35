package io.surfworks.gatekeeper.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ClientSettings}.
 */
class ClientSettingsTest {

    private static final String[] NO_ARGS = new String[0];

    @Test
    @DisplayName("license key comes from the environment")
    void fromEnvironment_envKey_used() {
        var settings = ClientSettings.fromEnvironment(
            Map.of(ClientSettings.ENV_LICENSE_KEY, " PRO-KEY "), NO_ARGS);

        assertEquals("PRO-KEY", settings.licenseKey());
    }

    @Test
    @DisplayName("--license takes precedence over the environment")
    void fromEnvironment_licenseArg_winsOverEnv() {
        var env = Map.of(ClientSettings.ENV_LICENSE_KEY, "ENV-KEY");

        assertEquals("ARG-KEY",
            ClientSettings.fromEnvironment(env, new String[] {"--verbose", "--license", "ARG-KEY"}).licenseKey());
        assertEquals("EQ-KEY",
            ClientSettings.fromEnvironment(env, new String[] {"--license=EQ-KEY"}).licenseKey());
    }

    @Test
    @DisplayName("--license without a value is rejected")
    void fromEnvironment_licenseWithoutValue_throws() {
        assertThrows(IllegalArgumentException.class,
            () -> ClientSettings.fromEnvironment(Map.of(), new String[] {"--license"}));
    }

    @Test
    @DisplayName("no key and no server by default")
    void fromEnvironment_empty_offlineWithoutKey() {
        var settings = ClientSettings.fromEnvironment(Map.of(), NO_ARGS);

        assertNull(settings.licenseKey());
        assertNull(settings.serverUrl());
        assertEquals(ClientSettings.CLIENT_VERSION, settings.clientVersion());
    }

    @Test
    @DisplayName("config dir precedence: explicit, then XDG, then home")
    void resolveConfigDir_precedence() {
        assertEquals(Path.of("/opt/gk"), ClientSettings.resolveConfigDir(Map.of(
            ClientSettings.ENV_CONFIG_DIR, "/opt/gk", "XDG_CONFIG_HOME", "/xdg")));
        assertEquals(Path.of("/xdg", "gatekeeper"), ClientSettings.resolveConfigDir(Map.of(
            "XDG_CONFIG_HOME", "/xdg")));
        assertEquals(Path.of(System.getProperty("user.home"), ".config", "gatekeeper"),
            ClientSettings.resolveConfigDir(Map.of()));
    }

    @Test
    @DisplayName("environment defaults to production")
    void fromEnvironment_noEnvironment_isProduction() {
        var settings = ClientSettings.fromEnvironment(
            Map.of(ClientSettings.ENV_ENFORCEMENT_DISABLED, "true"), NO_ARGS);

        assertTrue(settings.isProduction());
        assertTrue(settings.enforcementDisabled());
        assertFalse(settings.bypassEnforcement());
    }

    @Test
    @DisplayName("bypass is honoured only outside production")
    void bypassEnforcement_onlyOutsideProduction() {
        var dev = ClientSettings.fromEnvironment(Map.of(
            ClientSettings.ENV_ENVIRONMENT, "Development",
            ClientSettings.ENV_ENFORCEMENT_DISABLED, "1"), NO_ARGS);
        var prod = ClientSettings.fromEnvironment(Map.of(
            ClientSettings.ENV_ENVIRONMENT, "PRODUCTION",
            ClientSettings.ENV_ENFORCEMENT_DISABLED, "true"), NO_ARGS);
        var devNotRequested = ClientSettings.fromEnvironment(Map.of(
            ClientSettings.ENV_ENVIRONMENT, "development"), NO_ARGS);

        assertEquals("development", dev.environment());
        assertTrue(dev.bypassEnforcement());
        assertFalse(prod.bypassEnforcement());
        assertFalse(devNotRequested.bypassEnforcement());
    }
}
