package examples;

import com.agentswarm.CancellationScope;
import com.agentswarm.Swarm;
import com.agentswarm.agents.AnalysisAgent;
import com.agentswarm.agents.ReportAgent;
import com.agentswarm.agents.ResearchAgent;
import com.agentswarm.completion.CompletionClient;
import com.agentswarm.completion.CompletionClients;
import com.agentswarm.config.CompletionConfig;
import com.agentswarm.event.Event;
import com.agentswarm.event.Subscription;
import com.agentswarm.workflow.ResearchWorkflow;
import com.agentswarm.workflow.WorkflowDriver;
import com.agentswarm.workflow.WorkflowResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Example running the research, analysis and report pipeline on a swarm of three agents.
 * Uses a hosted model when OPENAI_API_KEY or ANTHROPIC_API_KEY is set, canned responses otherwise.
 * <p>
 * Usage: {@code ResearchSwarmExample [topic words...]}
 */
public class ResearchSwarmExample {

    private static final Logger logger = LoggerFactory.getLogger(ResearchSwarmExample.class);

    public static void main(String[] args) throws Exception {
        String topic = args.length > 0 ? String.join(" ", args) : "quantum computing applications";

        CompletionConfig completionConfig = CompletionConfig.fromEnvironment();
        CompletionClient client = CompletionClients.create(completionConfig);

        Swarm swarm = new Swarm("research-swarm");
        swarm.register(new ResearchAgent("researcher", client));
        swarm.register(new AnalysisAgent("analyst", client));
        swarm.register(new ReportAgent("reporter", client));

        CancellationScope root = CancellationScope.root();
        swarm.startAll(root);

        Thread monitor = startMonitor(swarm.events().subscribe());
        try {
            WorkflowResult result = new ResearchWorkflow(new WorkflowDriver(swarm)).run(topic);
            if (result.success()) {
                logger.info("Workflow finished in {}ms", result.duration().toMillis());
                logger.info("Final report:\n{}", result.finalOutput().orElse("(empty)"));
            } else {
                logger.error("Workflow failed at step {}: {}", result.failedStep().orElse("?"),
                        result.failure().map(r -> r.errorMessage()).orElse("unknown error"));
            }
        } finally {
            swarm.shutdown();
            root.cancel();
            monitor.join(1000);
            if (client instanceof AutoCloseable) {
                ((AutoCloseable) client).close();
            }
        }
    }

    private static Thread startMonitor(Subscription subscription) {
        Thread monitor = new Thread(() -> {
            try (subscription) {
                while (!subscription.isClosed()) {
                    Optional<Event> event = subscription.poll(Duration.ofMillis(200));
                    event.ifPresent(e -> logger.info("[{}] {} {}", e.actorId(), e.kind(), e.message()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "event-monitor");
        monitor.setDaemon(true);
        monitor.start();
        return monitor;
    }
}
