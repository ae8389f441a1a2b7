package io.graphlint.registry;

import io.graphlint.config.LintRuleConfig;
import io.graphlint.model.GraphKind;
import io.graphlint.model.GraphNode;
import io.graphlint.model.NodeGraph;
import io.graphlint.model.NodeKind;
import io.graphlint.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceResolverTest {

    private static final String PATH = "/Game/BP_Player.BP_Player";

    private ReferenceResolver resolver;
    private ReferenceRegistry registry;

    @BeforeEach
    void setUp() {
        resolver = new ReferenceResolver(LintRuleConfig.loadDefault());
        registry = new ReferenceRegistry();
    }

    private static Program programWith(NodeGraph graph) {
        return Program.builder().path(PATH).addGraph(graph).build();
    }

    @Test
    void index_recordsCallsWithQualifiedName() {
        NodeGraph graph = NodeGraph.builder("EventGraph", GraphKind.EVENT_GRAPH)
                .addNode(GraphNode.builder().id("c1").kind(NodeKind.CALL_FUNCTION)
                        .memberName("ApplyDamage").memberParent("BP_Enemy").execIn("exec").build())
                .addNode(GraphNode.builder().id("c2").kind(NodeKind.CALL_FUNCTION)
                        .memberName("ApplyDamage").execIn("exec").build())
                .build();

        resolver.index(programWith(graph), registry);

        assertThat(registry.isReferenced("ApplyDamage")).isTrue();
        assertThat(registry.isReferenced("BP_Enemy.ApplyDamage")).isTrue();
        assertThat(registry.callCount("ApplyDamage")).isEqualTo(2);
        assertThat(registry.isCalledFromOtherProgram("ApplyDamage", "/Game/Other.Other")).isTrue();
        assertThat(registry.isCalledFromOtherProgram("ApplyDamage", PATH)).isFalse();
    }

    @Test
    void index_recordsTimerCallbackFromDefaultValue() {
        NodeGraph graph = NodeGraph.builder("EventGraph", GraphKind.EVENT_GRAPH)
                .addNode(GraphNode.builder().id("timer").kind(NodeKind.CALL_FUNCTION)
                        .memberName("K2_SetTimer").execIn("exec")
                        .dataIn("FunctionName", "SpawnWave").dataIn("Time", "2.0").build())
                .build();

        resolver.index(programWith(graph), registry);

        assertThat(registry.isReferenced("SpawnWave")).isTrue();
        assertThat(registry.isReferenced("2.0")).isFalse();
    }

    @Test
    void index_ignoresConnectedTimerPin() {
        GraphNode name = GraphNode.builder().id("name").kind(NodeKind.LITERAL).dataOut("Value").build();
        NodeGraph graph = NodeGraph.builder("EventGraph", GraphKind.EVENT_GRAPH)
                .addNode(name)
                .addNode(GraphNode.builder().id("timer").kind(NodeKind.CALL_FUNCTION)
                        .memberName("K2_SetTimer").execIn("exec").dataIn("FunctionName", "Stale").build())
                .connect("name", "Value", "timer", "FunctionName")
                .build();

        resolver.index(programWith(graph), registry);

        assertThat(registry.isReferenced("Stale")).isFalse();
    }

    @Test
    void index_recordsDelegateAndBoundCustomEvent() {
        GraphNode bind = GraphNode.builder().id("bind").kind(NodeKind.DELEGATE_ADD)
                .memberName("OnDied").execIn("exec").delegateIn("Event").build();
        GraphNode handler = GraphNode.builder().id("handler").kind(NodeKind.CUSTOM_EVENT)
                .memberName("HandleDeath").execOut("then").delegateOut("OutputDelegate").build();
        NodeGraph graph = NodeGraph.builder("EventGraph", GraphKind.EVENT_GRAPH)
                .addNodes(bind, handler)
                .connect("handler", "OutputDelegate", "bind", "Event")
                .build();

        resolver.index(programWith(graph), registry);

        assertThat(registry.isReferenced("OnDied")).isTrue();
        assertThat(registry.isReferenced("HandleDeath")).isTrue();
        assertThat(ReferenceResolver.boundCustomEvents(graph, graph.node("bind").orElseThrow()))
                .extracting(GraphNode::id)
                .containsExactly("handler");
    }

    @Test
    void index_recordsMacroInstances() {
        NodeGraph graph = NodeGraph.builder("EventGraph", GraphKind.EVENT_GRAPH)
                .addNode(GraphNode.builder().id("m").kind(NodeKind.MACRO_INSTANCE)
                        .memberName("RetryLoop").execIn("exec").build())
                .build();

        resolver.index(programWith(graph), registry);

        assertThat(registry.isMacroReferenced("RetryLoop")).isTrue();
        assertThat(registry.isReferenced("RetryLoop")).isFalse();
    }

    @Test
    void isCalledFromOtherProgram_matchesSubstring() {
        registry.recordCallTarget("/Game/A.A", "Server_FireWeapon");

        assertThat(registry.isCalledFromOtherProgram("FireWeapon", "/Game/B.B")).isTrue();
        assertThat(registry.isCalledFromOtherProgram("Reload", "/Game/B.B")).isFalse();
    }

    @Test
    void recordCall_ignoresBlankNames() {
        registry.recordCall(PATH, " ");
        registry.recordReference(null);

        assertThat(registry.referencedNameCount()).isZero();
        assertThat(registry.snapshot()).isEmpty();
    }
}
