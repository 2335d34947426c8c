package org.carball.scholarflow.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.scholarflow.catalog.CatalogLoader;
import org.carball.scholarflow.catalog.ScholarshipCatalog;
import org.carball.scholarflow.catalog.UsageProbe;
import org.carball.scholarflow.config.SettingsLoader;
import org.carball.scholarflow.config.WorkflowSettings;
import org.carball.scholarflow.eligibility.EligibilityEvaluator;
import org.carball.scholarflow.exception.WorkflowException;
import org.carball.scholarflow.model.application.DocumentReference;
import org.carball.scholarflow.model.eligibility.EligibilityReport;
import org.carball.scholarflow.model.eligibility.ExemptionSet;
import org.carball.scholarflow.model.schema.FormSchema;
import org.carball.scholarflow.model.schema.MissingItem;
import org.carball.scholarflow.model.scholarship.ScholarshipType;
import org.carball.scholarflow.output.EligibilityReportWriter;
import org.carball.scholarflow.schema.SchemaRegistry;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dry-runs an applicant profile against a YAML scholarship catalog and reports eligibility and
 * missing items without creating an application.
 *
 * <p>Exit codes: 0 ready to submit, 2 not eligible or incomplete, 1 usage or input error.
 */
@Slf4j
public class ScholarFlowCLI {

    static final int EXIT_READY = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_READY = 2;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════╗
        ║   Scholarship Eligibility Dry Run  v%s     ║
        ╚═══════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, Clock.systemUTC()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        out.printf(BANNER + "%n", VERSION);

        if (args.length < 2 || isHelpRequested(args)) {
            printUsage(out);
            return args.length < 2 ? EXIT_ERROR : EXIT_READY;
        }

        try {
            CheckOptions options = parseArgs(args);
            WorkflowSettings settings = new SettingsLoader().loadSettings(args);

            ScholarshipCatalog catalog = new ScholarshipCatalog(UsageProbe.none());
            SchemaRegistry schemaRegistry = new SchemaRegistry(UsageProbe.none());
            new CatalogLoader(catalog, schemaRegistry).load(options.catalogFile);

            ApplicantProfile profile = loadProfile(options.applicantFile);
            ScholarshipType type = catalog.require(resolveTypeCode(options, profile, catalog));
            String subCode = options.subScholarship != null ? options.subScholarship : profile.getSubScholarship();
            String studentId = options.studentId != null ? options.studentId
                    : profile.getStudentId() != null ? profile.getStudentId() : "anonymous";

            out.println("\n🔍 Checking " + studentId + " against " + type.getCode()
                    + (subCode != null ? "/" + subCode : "") + "...");

            EligibilityReportWriter writer = check(settings, schemaRegistry, type, subCode, studentId, profile, clock.instant());
            String rendered = options.markdown ? writer.toMarkdown() : writer.toJson();

            if (options.outputFile != null) {
                Files.writeString(Paths.get(options.outputFile), rendered, StandardCharsets.UTF_8);
                out.println("   Report written to " + options.outputFile);
            } else {
                out.println(rendered);
            }

            out.println(writer.isReady() ? "\n✅ Ready to submit." : "\n❌ Not ready to submit.");
            return writer.isReady() ? EXIT_READY : EXIT_NOT_READY;

        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (WorkflowException e) {
            err.println("\n❌ " + e.getErrorCode() + ": " + e.getMessage());
            log.debug("Workflow error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        }
    }

    private static EligibilityReportWriter check(WorkflowSettings settings, SchemaRegistry schemaRegistry,
                                                 ScholarshipType type, String subCode, String studentId,
                                                 ApplicantProfile profile, Instant now) {
        EligibilityEvaluator evaluator = new EligibilityEvaluator(settings);

        List<MissingItem> missing = new ArrayList<>();
        if (type.isCombined() && subCode == null) {
            missing.add(MissingItem.subScholarship());
        }
        FormSchema schema = schemaRegistry.getSchema(type.getCode(), subCode);
        schemaRegistry.validateValues(schema, profile.getFields());
        List<DocumentReference> documents = profile.getDocuments().stream()
                .map(name -> new DocumentReference(name, name, now))
                .collect(Collectors.toList());
        missing.addAll(schemaRegistry.findMissing(schema, profile.getFields(), documents));

        EligibilityReport report = evaluator.preview(profile.getAcademicRecord(), type, subCode, ExemptionSet.none());
        List<String> eligibleSubs = type.isCombined()
                ? evaluator.eligibleSubScholarships(profile.getAcademicRecord(), type, ExemptionSet.none())
                : List.of();

        return new EligibilityReportWriter(type, subCode, studentId, report, missing, eligibleSubs, now);
    }

    private static String resolveTypeCode(CheckOptions options, ApplicantProfile profile, ScholarshipCatalog catalog) {
        if (options.typeCode != null) {
            return options.typeCode;
        }
        if (profile.getScholarship() != null) {
            return profile.getScholarship();
        }
        List<ScholarshipType> active = catalog.listActive();
        if (active.size() == 1) {
            return active.get(0).getCode();
        }
        throw new IllegalArgumentException("Scholarship type not specified; use --type");
    }

    private static ApplicantProfile loadProfile(Path applicantFile) throws IOException {
        File file = applicantFile.toFile();
        if (!file.exists()) {
            throw new IOException("Applicant file not found: " + applicantFile);
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ApplicantProfile profile = mapper.readValue(file, ApplicantProfile.class);
        log.info("Loaded applicant profile from: {}", applicantFile);
        return profile;
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage(PrintStream out) {
        out.println("\nUsage: java -jar scholarflow.jar <catalog-file> <applicant-file> [options]");
        out.println();
        out.println("Arguments:");
        out.println("  catalog-file        YAML scholarship catalog (types, rules, fields, documents)");
        out.println("  applicant-file      YAML applicant profile (academic record, field values, documents)");
        out.println();
        out.println("Options:");
        out.println("  --type, -t          Scholarship type code (default: from applicant file)");
        out.println("  --sub               Sub-scholarship code for combined scholarships");
        out.println("  --student           Student id shown in the report");
        out.println("  --format, -f        Output format: json|markdown (default: json)");
        out.println("  --output, -o        Write the report to a file instead of stdout");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.println(SettingsLoader.getSettingsHelp());
        out.println("Exit codes: 0 ready to submit, 2 not eligible or incomplete, 1 error");
    }

    private static CheckOptions parseArgs(String[] args) {
        CheckOptions options = new CheckOptions();
        options.catalogFile = Paths.get(args[0]);
        options.applicantFile = Paths.get(args[1]);

        for (int i = 2; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--settings.")) {
                // consumed by SettingsLoader
                i++;
                continue;
            }
            switch (arg) {
                case "--type", "-t" -> options.typeCode = requireValue(args, ++i, "Scholarship type not specified");
                case "--sub" -> options.subScholarship = requireValue(args, ++i, "Sub-scholarship not specified");
                case "--student" -> options.studentId = requireValue(args, ++i, "Student id not specified");
                case "--output", "-o" -> options.outputFile = requireValue(args, ++i, "Output file not specified");
                case "--format", "-f" -> {
                    String format = requireValue(args, ++i, "Output format not specified");
                    if (format.equalsIgnoreCase("markdown") || format.equalsIgnoreCase("md")) {
                        options.markdown = true;
                    } else if (format.equalsIgnoreCase("json")) {
                        options.markdown = false;
                    } else {
                        throw new IllegalArgumentException("Invalid output format. Use: json or markdown");
                    }
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static class CheckOptions {
        private Path catalogFile;
        private Path applicantFile;
        private String typeCode;
        private String subScholarship;
        private String studentId;
        private String outputFile;
        private boolean markdown;
    }
}
