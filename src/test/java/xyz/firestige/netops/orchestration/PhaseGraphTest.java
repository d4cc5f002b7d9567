package xyz.firestige.netops.orchestration;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import xyz.firestige.netops.exception.OrchestratorConfigException;
import xyz.firestige.netops.execution.DeviceAction;
import xyz.firestige.netops.testutil.TimingExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("PhaseGraph 单元测试")
class PhaseGraphTest {

    private static final DeviceAction NOOP = (device, directives, ctx) -> "ok";

    private static PhaseDefinition phase(String name, String... dependsOn) {
        return PhaseDefinition.builder(name).dependsOn(dependsOn).action(NOOP).build();
    }

    @Test
    @DisplayName("场景: 拓扑序保持声明顺序")
    void testTopologicalOrder() {
        PhaseGraph graph = PhaseGraph.builder()
                .phase(phase("backup", "routing", "vlans"))
                .phase(phase("interfaces"))
                .phase(phase("routing", "interfaces"))
                .phase(phase("vlans", "interfaces"))
                .build();

        assertEquals(List.of("interfaces", "routing", "vlans", "backup"), graph.topologicalOrder());
        assertEquals(List.of("routing", "vlans"), graph.dependentsOf("interfaces"));
        assertEquals(4, graph.size());
    }

    @Test
    @DisplayName("场景: 存在环 - 构建时拒绝并给出环路径")
    void testCycleRejected() {
        PhaseGraph.Builder builder = PhaseGraph.builder()
                .phase(phase("a", "c"))
                .phase(phase("b", "a"))
                .phase(phase("c", "b"));

        assertThatThrownBy(builder::build)
                .isInstanceOf(OrchestratorConfigException.class)
                .hasMessageContaining("阶段图存在环")
                .hasMessageContaining("a -> c -> b -> a");
    }

    @Test
    @DisplayName("场景: 依赖自身")
    void testSelfDependency() {
        assertThatThrownBy(() -> PhaseGraph.builder().phase(phase("a", "a")).build())
                .isInstanceOf(OrchestratorConfigException.class)
                .hasMessageContaining("自身");
    }

    @Test
    @DisplayName("场景: 依赖未声明的阶段")
    void testUnknownPredecessor() {
        assertThatThrownBy(() -> PhaseGraph.builder().phase(phase("routing", "interfaces")).build())
                .isInstanceOf(OrchestratorConfigException.class)
                .hasMessageContaining("interfaces");
    }

    @Test
    @DisplayName("场景: 阶段名重复")
    void testDuplicateName() {
        assertThatThrownBy(() -> PhaseGraph.builder().phase(phase("a")).phase(phase("a")).build())
                .isInstanceOf(OrchestratorConfigException.class);
    }

    @Test
    @DisplayName("场景: 阶段定义缺少动作或并发为负")
    void testInvalidDefinition() {
        assertThatThrownBy(() -> PhaseDefinition.builder("a").build()).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> PhaseDefinition.builder("a").action(NOOP).concurrency(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("场景: 标准配置图带连通性检查")
    void testStandardGraphWithConnectivity() {
        PhaseGraph graph = StandardPhaseGraphs.configurationRun(null, null, null, true);

        assertThat(graph.topologicalOrder())
                .containsExactly("connectivity", "interfaces", "routing", "vlans", "backup");
        assertThat(graph.get(StandardPhaseGraphs.BACKUP).getDependsOn()).containsExactly("routing", "vlans");
    }
}
