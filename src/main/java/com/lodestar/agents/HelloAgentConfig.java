package com.lodestar.agents;

import com.lodestar.core.emission.Emission;
import com.lodestar.core.emission.EmissionSpec;
import com.lodestar.core.fact.FactKind;
import com.lodestar.core.fact.FactView;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.phase.PhaseRule;
import com.lodestar.core.phase.PhaseSet;
import com.lodestar.core.policy.ControlPolicy;
import com.lodestar.core.policy.TransitionPolicy;
import com.lodestar.core.procedure.Action;
import com.lodestar.core.procedure.ActionContext;
import com.lodestar.core.procedure.ActionResult;
import com.lodestar.core.procedure.ProcedureTemplate;
import com.lodestar.core.spec.AgentSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The smallest useful agent: greets once, then completes.
 * <p>
 * START runs {@link SayHello}, which records {@code said_hello}; the rule
 * {@code said_hello -> DONE} moves the session on, and the completion key
 * ends it.
 */
@Configuration
public class HelloAgentConfig {

    public static final String NAME = "hello";

    @Bean
    public AgentSpec helloAgent() {
        return spec();
    }

    public static AgentSpec spec() {
        PhaseSet phases = PhaseSet.create("START", "DONE");
        return AgentSpec.builder(NAME)
                .version("1.0")
                .description("Says hello once, then completes")
                .phases(phases)
                .controlPolicy(ControlPolicy.builder()
                        .completionKeys(SayHello.SAID_HELLO)
                        .build())
                .transitionPolicy(TransitionPolicy.of(phases.phase("START"),
                        PhaseRule.enter(phases.phase("DONE")).whenAll(SayHello.SAID_HELLO).build()))
                .procedure(phases.phase("START"), ProcedureTemplate.of("greet", new SayHello()))
                .procedure(phases.phase("DONE"), ProcedureTemplate.empty("done"))
                .build();
    }

    public static class SayHello implements Action {

        private static final Logger log = LoggerFactory.getLogger(SayHello.class);

        static final String SAID_HELLO = "said_hello";

        static final EmissionSpec EMITS = EmissionSpec.builder()
                .emit(SAID_HELLO, Emission.of(Scope.SESSION, FactKind.PROGRESS))
                .build();

        @Override
        public EmissionSpec emits() {
            return EMITS;
        }

        @Override
        public ActionResult execute(FactView facts, ActionContext context) {
            String goal = facts.find("goal").map(v -> v.asString()).orElse("the world");
            log.info("Hello, {}!", goal);
            return ActionResult.success(EMITS.build(SAID_HELLO, true));
        }
    }
}
