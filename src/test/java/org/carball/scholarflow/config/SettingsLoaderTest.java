package org.carball.scholarflow.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class SettingsLoaderTest {

    @Test
    void shouldUseDefaultsWithoutOverrides() {
        // When
        WorkflowSettings settings = new SettingsLoader(Map.of()).loadSettings(new String[0]);

        // Then
        assertThat(settings).isEqualTo(WorkflowSettings.defaults());
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        SettingsLoader loader = new SettingsLoader(Map.of(
                "SCHOLARFLOW_GPA_SCALE_MAX", "4.0",
                "SCHOLARFLOW_ENFORCE_WINDOW", "false",
                "SCHOLARFLOW_APP_ID_PREFIX", "NCTU",
                "SCHOLARFLOW_ZONE_ID", "UTC"));

        // When
        WorkflowSettings settings = loader.loadSettings(new String[0]);

        // Then
        assertThat(settings.getGpaScaleMax()).isEqualByComparingTo("4.0");
        assertThat(settings.isEnforceApplicationWindow()).isFalse();
        assertThat(settings.getApplicationIdPrefix()).isEqualTo("NCTU");
        assertThat(settings.getZoneId()).isEqualTo("UTC");
    }

    @Test
    void shouldPreferCommandLineOverEnvironment() {
        // Given
        SettingsLoader loader = new SettingsLoader(Map.of("SCHOLARFLOW_APP_ID_PREFIX", "ENV"));
        String[] args = {"catalog.yml", "--settings.id-prefix", "CLI", "--settings.name", "campus"};

        // When
        WorkflowSettings settings = loader.loadSettings(args);

        // Then
        assertThat(settings.getApplicationIdPrefix()).isEqualTo("CLI");
        assertThat(settings.getSettingsName()).isEqualTo("campus");
    }

    @Test
    void shouldKeepDefaultOnInvalidNumber() {
        // When
        WorkflowSettings settings = new SettingsLoader(Map.of())
                .loadSettings(new String[]{"--settings.gpa-max", "four"});

        // Then
        assertThat(settings.getGpaScaleMax()).isEqualByComparingTo("4.30");
    }

    @Test
    void shouldDescribeEveryOption() {
        assertThat(SettingsLoader.getSettingsHelp())
                .contains("--settings.gpa-max", "--settings.zone", "SCHOLARFLOW_ENFORCE_WINDOW");
    }
}
