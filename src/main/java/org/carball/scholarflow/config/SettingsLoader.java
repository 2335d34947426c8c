package org.carball.scholarflow.config;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Map;

@Slf4j
public class SettingsLoader {

    private final Map<String, String> environment;

    public SettingsLoader() {
        this(System.getenv());
    }

    SettingsLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads settings using the hierarchy: CLI args > env vars > defaults
     */
    public WorkflowSettings loadSettings(String[] args) {
        log.debug("Loading workflow settings");

        WorkflowSettings.WorkflowSettingsBuilder builder = WorkflowSettings.builder();

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        WorkflowSettings settings = builder.build();
        settings.validate();

        log.info("Settings loaded: {}", settings.getSummary());
        return settings;
    }

    private void applyEnvironmentVariables(WorkflowSettings.WorkflowSettingsBuilder builder) {
        if (environment.containsKey("SCHOLARFLOW_GPA_SCALE_MAX")) {
            parseDecimal("SCHOLARFLOW_GPA_SCALE_MAX", environment.get("SCHOLARFLOW_GPA_SCALE_MAX"), builder);
        }
        if (environment.containsKey("SCHOLARFLOW_ENFORCE_WINDOW")) {
            builder.enforceApplicationWindow(Boolean.parseBoolean(environment.get("SCHOLARFLOW_ENFORCE_WINDOW")));
        }
        if (environment.containsKey("SCHOLARFLOW_APP_ID_PREFIX")) {
            builder.applicationIdPrefix(environment.get("SCHOLARFLOW_APP_ID_PREFIX"));
        }
        if (environment.containsKey("SCHOLARFLOW_ZONE_ID")) {
            builder.zoneId(environment.get("SCHOLARFLOW_ZONE_ID"));
        }
    }

    private void applyCLIArguments(WorkflowSettings.WorkflowSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--settings.gpa-max":
                    parseDecimal(arg, value, builder);
                    break;
                case "--settings.enforce-window":
                    builder.enforceApplicationWindow(Boolean.parseBoolean(value));
                    break;
                case "--settings.id-prefix":
                    builder.applicationIdPrefix(value);
                    break;
                case "--settings.zone":
                    builder.zoneId(value);
                    break;
                case "--settings.name":
                    builder.settingsName(value);
                    break;
            }
        }
    }

    private void parseDecimal(String source, String value, WorkflowSettings.WorkflowSettingsBuilder builder) {
        try {
            builder.gpaScaleMax(new BigDecimal(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for settings options.
     */
    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --settings.gpa-max <num>          Upper bound of the GPA scale (default: 4.30)
              --settings.enforce-window <bool>  Reject submissions outside the application window (default: true)
              --settings.id-prefix <text>       Prefix of generated application ids (default: APP)
              --settings.zone <zone-id>         Time zone used for application id years (default: Asia/Taipei)
              --settings.name <text>            Label shown in the settings summary

            Environment Variables:
              SCHOLARFLOW_GPA_SCALE_MAX
              SCHOLARFLOW_ENFORCE_WINDOW
              SCHOLARFLOW_APP_ID_PREFIX
              SCHOLARFLOW_ZONE_ID

            Priority: CLI arguments > environment variables > defaults
            """;
    }
}
