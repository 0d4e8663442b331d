package dev.repowarden.service;

import dev.repowarden.dispatch.ActionDispatcher;
import dev.repowarden.domain.event.RepositoryEvent;
import dev.repowarden.domain.valueobject.ActionPlan;
import dev.repowarden.domain.valueobject.DispatchOutcome;
import dev.repowarden.planner.ActionPlanner;
import dev.repowarden.platform.PlatformTarget;
import dev.repowarden.router.EventRouter;
import dev.repowarden.router.RouterResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single entry point for one event: route, plan, dispatch.
 *
 * <pre>
 *  1. Router picks the path and gathers findings or the parsed command
 *  2. Planner turns them into an ActionPlan
 *  3. Dispatcher applies the plan and reports per-action outcomes
 * </pre>
 *
 * Never throws for platform or classifier trouble; those end up in the outcome.
 */
@Service
public class EventPipeline {

    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    private final EventRouter router;
    private final ActionPlanner planner;
    private final ActionDispatcher dispatcher;
    private final Timer pipelineTimer;

    public EventPipeline(EventRouter router, ActionPlanner planner, ActionDispatcher dispatcher,
                         MeterRegistry meterRegistry) {
        this.router = router;
        this.planner = planner;
        this.dispatcher = dispatcher;
        this.pipelineTimer = Timer.builder("repowarden.pipeline.duration")
                .description("Time from routing an event to the last dispatched action")
                .register(meterRegistry);
    }

    public DispatchOutcome handle(RepositoryEvent event) {
        return pipelineTimer.record(() -> process(event));
    }

    private DispatchOutcome process(RepositoryEvent event) {
        RouterResult result = router.route(event);

        if (result instanceof RouterResult.Skipped skipped) {
            return DispatchOutcome.skipped(event.deliveryId(), skipped.reason());
        }
        if (result instanceof RouterResult.Classified classified) {
            ActionPlan plan = planner.plan(classified.findings(), null, classified.context());
            return dispatch(event, plan, classified.target());
        }
        RouterResult.Commanded commanded = (RouterResult.Commanded) result;
        ActionPlan plan = commanded.parse().asCommand()
                .map(command -> planner.plan(List.of(), command, commanded.context()))
                .orElseGet(() -> planner.planHint(commanded.parse(), commanded.context()));
        return dispatch(event, plan, commanded.target());
    }

    private DispatchOutcome dispatch(RepositoryEvent event, ActionPlan plan, PlatformTarget target) {
        if (plan.isEmpty()) {
            log.info("Nothing to do for delivery {} ({})", event.deliveryId(), event.kind());
            return DispatchOutcome.skipped(event.deliveryId(), "empty plan");
        }
        return dispatcher.dispatch(event.deliveryId(), plan, target);
    }
}
