package com.lodestar.agents;

import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactKind;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.procedure.ActionContext;
import com.lodestar.core.procedure.ActionResult;
import com.lodestar.core.spec.AgentSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HelloAgentConfigTest {

    @Test
    @DisplayName("spec builds without warnings")
    void specIsClean() {
        AgentSpec spec = HelloAgentConfig.spec();

        assertEquals("hello", spec.name());
        assertEquals(List.of("START", "DONE"), spec.phases().names());
        assertTrue(spec.warnings().isEmpty());
    }

    @Test
    @DisplayName("phase is START until said_hello is recorded")
    void derivesPhase() {
        AgentSpec spec = HelloAgentConfig.spec();

        assertEquals("START", spec.derivePhase(Set.of()).name());
        assertEquals("DONE", spec.derivePhase(Set.of("said_hello")).name());
    }

    @Test
    @DisplayName("SayHello emits a session-scoped progress flag")
    void sayHelloEmits() throws Exception {
        AgentSpec spec = HelloAgentConfig.spec();
        var context = new ActionContext("hello", "s1", 1, spec.phases().phase("START"), null, null);

        ActionResult result = new HelloAgentConfig.SayHello()
                .execute(Facts.of(Fact.of("goal", "tests", Scope.PERSISTENT)), context);

        assertTrue(result.isSuccess());
        Fact said = result.facts().get("said_hello").orElseThrow();
        assertTrue(said.value().asBoolean());
        assertEquals(Scope.SESSION, said.scope());
        assertEquals(FactKind.PROGRESS, said.kind());
    }
}
