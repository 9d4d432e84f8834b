package com.ryuqq.agentflow.core.orchestration;

/**
 * Durable workflow function.
 *
 * <p>The function is re-executed from the start on every activation. It must be
 * deterministic: all non-determinism (time, ids, I/O) goes through the
 * {@link OrchestrationContext}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Orchestration writer = ctx -&gt; {
 *     String text = ctx.getInput(String.class);
 *     String english = ctx.callAgent("english_paragraph_writer_agent", "", text).await();
 *     Task&lt;String&gt; french = ctx.callAgent("french_translator_agent", "", english);
 *     Task&lt;String&gt; spanish = ctx.callAgent("spanish_translator_agent", "", english);
 *     ctx.allOf(List.of(french, spanish)).await();
 *     return Map.of("english", english, "french", french.await(), "spanish", spanish.await());
 * };
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Orchestration {

    /**
     * Runs the workflow.
     *
     * @param ctx the deterministic orchestration context
     * @return the output, serialized to JSON when the instance completes
     * @throws Exception any failure; the instance is marked FAILED
     */
    Object run(OrchestrationContext ctx) throws Exception;
}
