package com.dedicatedcode.crimecity;

import com.dedicatedcode.crimecity.config.CrimeCityConfiguration;
import com.dedicatedcode.crimecity.service.pipeline.BuildReport;
import com.dedicatedcode.crimecity.service.pipeline.BuildRequest;
import com.dedicatedcode.crimecity.service.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrimeCityApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(CrimeCityApplication.class);

    private final PipelineOrchestrator orchestrator;
    private final CrimeCityConfiguration config;

    public CrimeCityApplication(PipelineOrchestrator orchestrator, CrimeCityConfiguration config) {
        this.orchestrator = orchestrator;
        this.config = config;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CrimeCityApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    private void printUsage() {
        logger.info("CrimeCity builds incident aggregates and map features from the files in the data directory.");
        logger.info("Usage:");
        logger.info("  --build                   build every target whose inputs changed");
        logger.info("  --resolutions 4,5,6       grid resolutions to build (default {})", config.getGrid().getResolutions());
        logger.info("  --data-dir DIR            data directory (default {})", config.getDataDir());
        logger.info("  --force                   rebuild all stages even when up to date");
        logger.info("  --skip-municipalities     do not build the municipality target");
    }

    @Override
    public void run(String... args) {
        BuildArguments arguments;
        try {
            arguments = BuildArguments.parse(args);
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            printUsage();
            System.exit(2);
            return;
        }

        if (!arguments.build()) {
            printUsage();
            return;
        }

        if (arguments.dataDir() != null) {
            config.setDataDir(arguments.dataDir());
        }
        BuildRequest request = new BuildRequest(
                arguments.resolutions() != null ? arguments.resolutions() : config.getGrid().getResolutions(),
                config.getPipeline().isMunicipalitiesEnabled() && !arguments.skipMunicipalities(),
                arguments.force());

        try {
            BuildReport report = orchestrator.build(request);
            System.exit(report.isSuccessful() ? 0 : 1);
        } catch (Exception e) {
            logger.error("Build failed", e);
            System.exit(1);
        }
    }
}
