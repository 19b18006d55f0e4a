package com.customertimes.redmine.migration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashSet;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.*;

class MigrationConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperty() {
        System.clearProperty("config.file.path");
    }

    private static MigrationConfig parseTestConfig() throws Exception {
        try (InputStream is = MigrationConfigTest.class.getResourceAsStream("/config-test.xml")) {
            return MigrationConfig.parse(is);
        }
    }

    @Test
    @DisplayName("Source, target and options are flattened into parameters")
    void flattenedParameters() throws Exception {
        MigrationConfig config = parseTestConfig();

        assertEquals("https://redmine.test", config.get("source-redmine-url"));
        assertEquals("secret", config.get("source-api-key"));
        assertEquals("demo", config.get("source-project-name"));
        assertEquals("https://gitea.test", config.get("target-gitea-url"));
        assertEquals("token", config.getInitParams().get("target-api-token"));
        assertEquals("acme/demo", config.getRepository());
        assertEquals(25, config.getPageSize());
        assertEquals("importer", config.getFallbackUsername());
        assertEquals(TimeZone.getTimeZone("UTC"), config.getTimeZone());
        assertEquals(3, config.getLabelMaxAttempts());
        assertTrue(config.isSkipEmptyJournals());
    }

    @Test
    @DisplayName("Mapping sections replace the built-in defaults")
    void mappings() throws Exception {
        MigrationConfig config = parseTestConfig();

        assertEquals("jdoe", config.getUserMap().get("John Doe"));
        assertEquals("mmajor", config.getUserMap().get("Mary Major"));
        assertEquals(2, config.getTrackerMap().size());
        assertEquals("task", config.getTrackerMap().get("Task"));
        assertNull(config.getTrackerMap().get("Feature"));
        assertEquals(new HashSet<String>(Arrays.asList("Done", "Won't do")), config.getClosedStatuses());
        assertEquals("Won't do", config.getRejectedStatus());
        assertEquals("invalid", config.getRejectedLabel());
    }

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void defaults() {
        MigrationConfig config = new MigrationConfig();

        assertEquals("enhancement", config.getTrackerMap().get("Feature"));
        assertEquals("support", config.getTrackerMap().get("Support"));
        assertEquals(new HashSet<String>(Arrays.asList("Resolved", "Closed", "Rejected")), config.getClosedStatuses());
        assertEquals("Rejected", config.getRejectedStatus());
        assertEquals("wontfix", config.getRejectedLabel());
        assertEquals(Paths.get("migration-registry.json"), config.getRegistryFile());
        assertEquals(Paths.get("pending-references.json"), config.getPendingReferencesFile());
        assertEquals(Paths.get("migration-progress.json"), config.getProgressFile());
        assertEquals(TimeZone.getTimeZone("Europe/Amsterdam"), config.getTimeZone());
        assertEquals(JournalRenderer.DEFAULT_DATE_FORMAT, config.getDateFormat());
        assertEquals(10, config.getLabelMaxAttempts());
        assertEquals(500, config.getLabelRetryIntervalMillis());
        assertEquals(8000, config.getLabelMaxIntervalMillis());
        assertEquals(0, config.getRunTimeoutMinutes());
        assertEquals(100, config.getPageSize());
        assertEquals("", config.getFallbackUsername());
        assertFalse(config.isSkipEmptyJournals());
        assertFalse(config.isDeriveUsernames());
    }

    @Test
    @DisplayName("Empty values fall back to the default")
    void emptyValue() {
        MigrationConfig config = new MigrationConfig();
        config.set("options-time-zone", "");
        assertEquals("Europe/Amsterdam", config.get("options-time-zone", "Europe/Amsterdam"));
    }

    @Test
    @DisplayName("Configuration file is taken from the system property")
    void loadFromProperty() throws Exception {
        Path file = tempDir.resolve("config.xml");
        Files.write(file, ("<migration><target><repo>other/repo</repo></target>"
                + "<options><derive-usernames>true</derive-usernames></options></migration>")
                .getBytes(StandardCharsets.UTF_8));
        System.setProperty("config.file.path", file.toString());

        MigrationConfig config = MigrationConfig.load();

        assertEquals("other/repo", config.getRepository());
        assertTrue(config.isDeriveUsernames());
        assertEquals("bug", config.getTrackerMap().get("Bug"));
    }

    @Test
    @DisplayName("Missing configuration file is fatal")
    void missingFile() {
        System.setProperty("config.file.path", tempDir.resolve("missing.xml").toString());
        assertThrows(MigrationException.class, MigrationConfig::load);
    }

    @Test
    @DisplayName("Malformed XML and doctypes are rejected")
    void malformed() {
        assertThrows(MigrationException.class, () -> MigrationConfig.parse(
                new ByteArrayInputStream("<migration><source>".getBytes(StandardCharsets.UTF_8))));
        assertThrows(MigrationException.class, () -> MigrationConfig.parse(new ByteArrayInputStream(
                "<!DOCTYPE migration [<!ENTITY x \"y\">]><migration/>".getBytes(StandardCharsets.UTF_8))));
    }
}
