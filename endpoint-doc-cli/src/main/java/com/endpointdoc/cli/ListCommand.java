package com.endpointdoc.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.document.DocumentBuilder;
import com.endpointdoc.core.processor.OperationProcessor;
import com.endpointdoc.core.renderer.DocumentRenderer;

import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available processors or renderers.
 */
@Command(
    name = "list",
    description = "List available processors or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Type to list: processors, renderers")
    private String type;

    @Override
    public Integer call() {
        switch (type.toLowerCase()) {
            case "processors" -> listProcessors();
            case "renderers" -> listRenderers();
            default -> {
                System.err.println("Unknown type: " + type);
                System.err.println("Valid types: processors, renderers");
                return 1;
            }
        }
        return 0;
    }

    private void listProcessors() {
        System.out.println("Available Operation Processors:");
        for (OperationProcessor processor : new DocumentBuilder(DocumentOptions.defaults()).getProcessors()) {
            System.out.printf("  • %s (order: %d)%n", processor.getId(), processor.getOrder());
        }
    }

    private void listRenderers() {
        System.out.println("Available Renderers:");
        ServiceLoader.load(DocumentRenderer.class)
            .forEach(r -> System.out.printf("  • %s%n", r.getId()));
    }
}
