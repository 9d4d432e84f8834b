package com.ryuqq.agentflow.testkit.agent;

import com.ryuqq.agentflow.core.agent.AgentDefinition;
import com.ryuqq.agentflow.core.agent.AgentReply;
import com.ryuqq.agentflow.core.agent.AgentRunner;
import com.ryuqq.agentflow.core.agent.Transcript;
import com.ryuqq.agentflow.core.agent.Turn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Deterministic {@link AgentRunner} test double for transcript agents.
 *
 * <p>Replies come from a queue of scripted steps first, then from a fallback function
 * (echo by default). Every call is recorded together with the transcript size it saw, and
 * the highest number of overlapping calls is tracked so tests can assert serialized access.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScriptedAgentRunner runner = ScriptedAgentRunner.replying(input -&gt; "haiku about " + input)
 *     .thenFail(new IllegalStateException("model down"));
 * AgentDefinition&lt;Transcript&gt; agent = runner.asAgent("haiku_agent");
 * </pre>
 *
 * @author Agentflow Team
 * @since 1.0.0
 */
public class ScriptedAgentRunner implements AgentRunner<Transcript> {

    private final Function<String, String> fallback;
    private final Queue<Step> script = new ConcurrentLinkedQueue<>();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxConcurrent = new AtomicInteger();
    private volatile long delayMs;

    private ScriptedAgentRunner(Function<String, String> fallback) {
        this.fallback = fallback;
    }

    public static ScriptedAgentRunner echo() {
        return new ScriptedAgentRunner(input -> input);
    }

    public static ScriptedAgentRunner replying(Function<String, String> fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        return new ScriptedAgentRunner(fallback);
    }

    /**
     * Queues a fixed reply for the next unscripted call.
     */
    public ScriptedAgentRunner thenReply(String output) {
        script.add(new Step(output, null));
        return this;
    }

    /**
     * Queues a failure for the next unscripted call.
     */
    public ScriptedAgentRunner thenFail(Exception failure) {
        script.add(new Step(null, failure));
        return this;
    }

    /**
     * Makes every call sleep before answering, widening race windows.
     */
    public ScriptedAgentRunner withDelay(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    public AgentDefinition<Transcript> asAgent(String agentName) {
        return AgentDefinition.transcript(agentName, this);
    }

    @Override
    public AgentReply<Transcript> run(Transcript state, String input) throws Exception {
        int now = active.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        try {
            calls.add(new Call(input, state.size()));
            if (delayMs > 0) {
                Thread.sleep(delayMs);
            }
            Step step = script.poll();
            if (step != null && step.failure != null) {
                throw step.failure;
            }
            String output = step != null ? step.output : fallback.apply(input);
            return new AgentReply<>(state.append(Turn.assistant(output)), output);
        } finally {
            active.decrementAndGet();
        }
    }

    public List<Call> getCalls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public int callCount() {
        return calls.size();
    }

    public int maxConcurrentCalls() {
        return maxConcurrent.get();
    }

    /**
     * One recorded invocation.
     *
     * @param input the raw input text
     * @param transcriptSize number of turns the runner saw, including the new user turn
     */
    public record Call(String input, int transcriptSize) {
    }

    private static final class Step {

        private final String output;
        private final Exception failure;

        Step(String output, Exception failure) {
            this.output = output;
            this.failure = failure;
        }
    }
}
