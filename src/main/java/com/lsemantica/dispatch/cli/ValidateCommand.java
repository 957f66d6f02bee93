package com.lsemantica.dispatch.cli;

import com.lsemantica.core.contract.ContractLoader;
import com.lsemantica.core.contract.ContractName;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lsemantica validate &lt;file&gt; --contract &lt;name&gt;
 * <p>
 * Checks one contract document against its pinned version and JSON Schema.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a versioned contract document")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Contract JSON file")
    private Path file;

    @Option(names = {"--contract", "-c"}, defaultValue = "SemanticIR",
            description = "SemanticIR, PolicyProfile, VerificationContract, FeedbackTensor or RuntimeContracts")
    private String contract;

    private final ContractLoader contractLoader;

    public ValidateCommand(ContractLoader contractLoader) {
        this.contractLoader = contractLoader;
    }

    @Override
    public Integer call() throws Exception {
        return CommandSupport.guarded(() -> {
            ContractName name = ContractName.fromDisplayName(contract);
            contractLoader.validate(name, CommandSupport.readJson(file));
            ConsoleOutput.success(name.displayName() + " contract is valid: " + file);
            return CommandSupport.EXIT_OK;
        });
    }
}
