package com.endpointdoc.core.processor;

/**
 * Post-processing step applied to every seeded operation of a document.
 *
 * <p>Processors are discovered via Java Service Provider Interface (SPI) and run in
 * {@link #getOrder()} order (lower first) for each endpoint. The built-in
 * {@link EndpointOperationProcessor} runs first; additional processors see its finished output.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.endpointdoc.core.processor.OperationProcessor}
 *
 * @see OperationContext
 */
public interface OperationProcessor {

    /**
     * Returns unique identifier for this processor.
     *
     * <p>Should be kebab-case (e.g., "endpoint", "security-requirements").
     *
     * @return unique processor identifier
     */
    String getId();

    /**
     * Returns execution order for this processor.
     *
     * @return order value (lower = earlier execution)
     */
    default int getOrder() {
        return 100;
    }

    /**
     * Processes one operation.
     *
     * @param context operation, its descriptor and the shared document state
     * @return false to exclude the operation from the document
     */
    boolean process(OperationContext context);
}
