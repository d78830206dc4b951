package com.idp.sa.token.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.idp.sa.token.AssertionSigningException;
import com.idp.sa.token.ConfigException;
import com.idp.sa.token.ExchangeException;
import com.idp.sa.token.KeyMaterialException;
import com.idp.sa.token.ResponseParseException;
import com.idp.sa.token.ServiceAccountTokenConfig;
import com.idp.sa.token.ServiceAccountTokenGenerator;
import com.idp.sa.token.TokenException;
import com.idp.sa.token.TokenResult;
import com.idp.sa.token.TransportException;

import lombok.extern.slf4j.Slf4j;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Slf4j
@Command(name = "sa-token",
    mixinStandardHelpOptions = true,
    version = "sa-token 0.1.0",
    showDefaultValues = true,
    description = "Generate a service account access token with the JWT-Bearer grant.%n"
        + "Example: sa-token -c config.yaml -o json")
public class TokenCommand implements Callable<Integer> {
    static final int EXIT_CONFIG = 3;
    static final int EXIT_KEY_MATERIAL = 4;
    static final int EXIT_ASSERTION = 5;
    static final int EXIT_TRANSPORT = 6;
    static final int EXIT_RESPONSE_PARSE = 7;
    static final int EXIT_EXCHANGE = 8;

    private static final String LOGGER_ROOT = "com.idp.sa.token";

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--config"}, required = true, description = "Token configuration file (YAML).")
    Path config;

    @Option(names = {"-o", "--output"}, defaultValue = "TEXT",
        description = "Output format: ${COMPLETION-CANDIDATES}.")
    OutputFormat output;

    @Option(names = {"-v", "--verbose"}, description = "Log each pipeline step to stderr.")
    boolean verbose;

    private final ServiceAccountTokenGenerator generator;

    public TokenCommand() {
        this(ServiceAccountTokenGenerator.create());
    }

    public TokenCommand(ServiceAccountTokenGenerator generator) {
        this.generator = generator;
    }

    @Override
    public Integer call() {
        ServiceAccountTokenConfig tokenConfig = ConfigLoader.load(config);
        if (verbose || tokenConfig.isVerbose()) {
            Configurator.setLevel(LOGGER_ROOT, Level.DEBUG);
        }
        TokenResult result = generator.generate(tokenConfig);

        PrintWriter out = spec.commandLine().getOut();
        out.print(output.render(result));
        out.flush();
        return 0;
    }

    static int exitCodeFor(Throwable ex) {
        if (ex instanceof ConfigException) {
            return EXIT_CONFIG;
        } else if (ex instanceof KeyMaterialException) {
            return EXIT_KEY_MATERIAL;
        } else if (ex instanceof AssertionSigningException) {
            return EXIT_ASSERTION;
        } else if (ex instanceof TransportException) {
            return EXIT_TRANSPORT;
        } else if (ex instanceof ResponseParseException) {
            return EXIT_RESPONSE_PARSE;
        } else if (ex instanceof ExchangeException) {
            return EXIT_EXCHANGE;
        }
        return CommandLine.ExitCode.SOFTWARE;
    }

    public static CommandLine commandLine(TokenCommand command) {
        CommandLine commander = new CommandLine(command);
        commander.setCaseInsensitiveEnumValuesAllowed(true);
        commander.setExitCodeExceptionMapper(TokenCommand::exitCodeFor);
        commander.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof TokenException tokenException) {
                cmd.getErr().println("Token generation failed: " + tokenException.getMessage());
                if (tokenException.isRetryable()) {
                    cmd.getErr().println("The failure may be transient, run the command again.");
                }
            } else {
                log.error("Unexpected failure", ex);
                cmd.getErr().println("Token generation failed: " + ex);
            }
            cmd.getErr().flush();
            return exitCodeFor(ex);
        });
        return commander;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new TokenCommand()).execute(args));
    }
}
