package com.retosca.engine.cli;

import com.retosca.engine.cli.exception.OptionsValidationException;
import com.retosca.engine.cli.model.ReverseOptions;
import com.retosca.engine.cli.model.ValidatedReverseOptions;
import com.retosca.engine.cli.output.ReverseResultsPrinter;
import com.retosca.engine.cli.validation.ReverseOptionsValidator;
import com.retosca.engine.core.exception.ExtractionFailureException;
import com.retosca.engine.core.exception.MappingOrchestrationException;
import com.retosca.engine.ir.ServiceTemplateWriter;
import com.retosca.engine.mapping.MapperRegistry;
import com.retosca.engine.plan.PlanDocument;
import com.retosca.engine.plan.PlanLoader;
import com.retosca.engine.translate.PlanTranslator;
import com.retosca.engine.translate.TranslationResult;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Translates one Terraform plan into a TOSCA service template.
 */
@Command(
        name = "reverse",
        mixinStandardHelpOptions = true,
        version = "retosca 1.0.0",
        description = "Reverse-engineers a Terraform plan JSON document into a TOSCA 2.0 service template.",
        exitCodeOnInvalidInput = 1
)
public class ReverseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReverseCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_MAPPER_FAILURES = 2;

    @Mixin
    private ReverseOptions options = new ReverseOptions();

    private final ReverseOptionsValidator validator = new ReverseOptionsValidator();
    private final ReverseResultsPrinter printer = new ReverseResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }
        try {
            ValidatedReverseOptions validated = validator.validate(options);
            printer.printBanner(validated);

            PlanDocument plan = new PlanLoader().load(validated.getPlanPath());
            TranslationResult result = new PlanTranslator(MapperRegistry.defaultRegistry(),
                    validated.getTranslatorConfig()).translate(plan);

            ServiceTemplateWriter writer = new ServiceTemplateWriter();
            if (validated.writesToStdout()) {
                System.out.print(writer.toYaml(result.getTemplate()));
            } else {
                writer.write(result.getTemplate(), validated.getOutputPath());
            }
            printer.printSummary(validated, result);

            if (result.hasMapperFailures() && options.isFailOnMapperErrors()) {
                log.error("{} resource(s) failed to map", result.getStats().getFailed());
                return EXIT_MAPPER_FAILURES;
            }
            return EXIT_OK;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(err -> log.error("Invalid option: {}", err));
            return EXIT_FAILURE;
        } catch (ExtractionFailureException e) {
            log.error("Plan extraction failed: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (MappingOrchestrationException e) {
            log.error("Translation aborted", e);
            return EXIT_FAILURE;
        }
    }

    ReverseOptions getOptions() {
        return options;
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME) instanceof ch.qos.logback.classic.Logger root) {
            root.setLevel(Level.DEBUG);
        }
    }
}
