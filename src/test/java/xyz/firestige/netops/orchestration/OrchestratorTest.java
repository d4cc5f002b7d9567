package xyz.firestige.netops.orchestration;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.domain.outcome.OutcomeStatus;
import xyz.firestige.netops.domain.outcome.SkipCause;
import xyz.firestige.netops.event.DomainEventPublisher;
import xyz.firestige.netops.event.PhaseCompletedEvent;
import xyz.firestige.netops.exception.ErrorType;
import xyz.firestige.netops.execution.DeviceAction;
import xyz.firestige.netops.execution.PhaseExecutor;
import xyz.firestige.netops.execution.PhaseResult;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.execution.retry.RetryStrategy;
import xyz.firestige.netops.testutil.TestFleet;
import xyz.firestige.netops.testutil.TimingExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Orchestrator 单元测试
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("Orchestrator 单元测试")
class OrchestratorTest {

    private static final DeviceAction OK = (device, directives, ctx) -> "ok";

    private PhaseExecutor phaseExecutor;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        phaseExecutor = new PhaseExecutor(4, RetryStrategy.none(), null);
        orchestrator = new Orchestrator(phaseExecutor);
    }

    @AfterEach
    void tearDown() {
        phaseExecutor.close();
    }

    private static PhaseGraph diamond(DeviceAction interfaces, DeviceAction routing, DeviceAction vlans,
                                      DeviceAction backup) {
        return PhaseGraph.builder()
                .phase(PhaseDefinition.builder("interfaces").action(interfaces).build())
                .phase(PhaseDefinition.builder("routing").dependsOn("interfaces").action(routing).build())
                .phase(PhaseDefinition.builder("vlans").dependsOn("interfaces").action(vlans).build())
                .phase(PhaseDefinition.builder("backup").dependsOn("routing", "vlans").action(backup).build())
                .build();
    }

    private OrchestrationResult run(PhaseGraph graph, RunContext ctx) {
        return orchestrator.run(graph, TestFleet.inventory(), TestFleet.intents(), ctx);
    }

    @Test
    @DisplayName("场景: 阶段在所有前驱完成之后才开始")
    void testPredecessorsCompleteBeforeStart() {
        // When
        OrchestrationResult result = run(diamond(OK, OK, OK, OK), RunContext.standalone());

        // Then
        assertTrue(result.isAllCompleted());
        PhaseRun interfaces = result.phase("interfaces");
        PhaseRun routing = result.phase("routing");
        PhaseRun vlans = result.phase("vlans");
        PhaseRun backup = result.phase("backup");
        assertTrue(routing.getStartSequence() > interfaces.getCompleteSequence());
        assertTrue(vlans.getStartSequence() > interfaces.getCompleteSequence());
        assertTrue(backup.getStartSequence() > routing.getCompleteSequence());
        assertTrue(backup.getStartSequence() > vlans.getCompleteSequence());
        assertEquals(12, result.allOutcomes().size());
    }

    @Test
    @DisplayName("场景: 设备级失败不阻止下游阶段")
    void testDeviceFailureDoesNotBlockDependents() {
        // Given: interfaces 阶段 R3 失败
        DeviceAction interfaces = (device, directives, ctx) -> {
            if (device.getName().equals("R3")) {
                throw new IllegalStateException("R3 failed");
            }
            return "ok";
        };

        // When
        OrchestrationResult result = run(diamond(interfaces, OK, OK, OK), RunContext.standalone());

        // Then
        assertEquals(OutcomeStatus.FAILED, result.phase("interfaces").getResult().outcomeOf("R3").getStatus());
        assertEquals(3, result.phase("routing").getResult().count(OutcomeStatus.SUCCEEDED));
        assertEquals(3, result.phase("vlans").getResult().count(OutcomeStatus.SUCCEEDED));
        assertEquals(3, result.phase("backup").getResult().count(OutcomeStatus.SUCCEEDED));
    }

    @Test
    @DisplayName("场景: 无依赖关系的阶段并行执行")
    void testIndependentPhasesRunInParallel() {
        // Given: routing 与 vlans 互相等待对方开始，串行执行时会超时失败
        CountDownLatch bothStarted = new CountDownLatch(2);
        DeviceAction rendezvous = (device, directives, ctx) -> {
            bothStarted.countDown();
            if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("另一个阶段没有并行启动");
            }
            return "ok";
        };
        PhaseGraph graph = PhaseGraph.builder()
                .phase(PhaseDefinition.builder("interfaces").action(OK).build())
                .phase(PhaseDefinition.builder("routing").dependsOn("interfaces").devices(Set.of("R1"))
                        .action(rendezvous).build())
                .phase(PhaseDefinition.builder("vlans").dependsOn("interfaces").devices(Set.of("R1"))
                        .action(rendezvous).build())
                .build();

        // When
        OrchestrationResult result = run(graph, RunContext.standalone());

        // Then
        assertEquals(OutcomeStatus.SUCCEEDED, result.phase("routing").getResult().outcomeOf("R1").getStatus());
        assertEquals(OutcomeStatus.SUCCEEDED, result.phase("vlans").getResult().outcomeOf("R1").getStatus());
    }

    @Test
    @DisplayName("场景: 阶段只下发自己的指令切片")
    void testDirectiveSlices() {
        AtomicInteger routingDirectives = new AtomicInteger();
        DeviceAction routing = (device, directives, ctx) -> {
            routingDirectives.addAndGet(directives.size());
            return "ok";
        };
        PhaseGraph graph = PhaseGraph.builder()
                .phase(PhaseDefinition.builder("routing")
                        .stage(Stage.ROUTING)
                        .action(routing).build())
                .build();

        run(graph, RunContext.standalone());

        // 每台设备一条路由指令
        assertEquals(3, routingDirectives.get());
    }

    @Test
    @DisplayName("场景: 阶段执行器崩溃 - 本阶段设备失败，下游阶段跳过")
    void testExecutorCrash() {
        // Given
        PhaseExecutor crashing = new PhaseExecutor(4, RetryStrategy.none(), null) {
            @Override
            public PhaseResult execute(String phase, List<Device> devices, Function<Device, List<Directive>> slices,
                                       DeviceAction action, int concurrency, RunContext ctx) {
                if (phase.equals("routing")) {
                    throw new IllegalStateException("executor crashed");
                }
                return super.execute(phase, devices, slices, action, concurrency, ctx);
            }
        };
        Orchestrator crashingOrchestrator = new Orchestrator(crashing);

        // When
        OrchestrationResult result = crashingOrchestrator.run(diamond(OK, OK, OK, OK),
                TestFleet.inventory(), TestFleet.intents(), RunContext.standalone());
        crashing.close();

        // Then
        assertTrue(result.isAllCompleted());
        PhaseRun routing = result.phase("routing");
        assertTrue(routing.isCrashed());
        assertNotNull(routing.getCrash());
        assertEquals(3, routing.getResult().count(OutcomeStatus.FAILED));
        assertEquals(ErrorType.SYSTEM_ERROR, routing.getResult().outcomeOf("R1").getFailure().getErrorType());
        assertEquals(3, result.phase("vlans").getResult().count(OutcomeStatus.SUCCEEDED));
        PhaseResult backup = result.phase("backup").getResult();
        assertEquals(3, backup.count(OutcomeStatus.SKIPPED));
        assertEquals(SkipCause.PREDECESSOR_CRASHED, backup.outcomeOf("R2").getSkipCause());
    }

    @Test
    @DisplayName("场景: interfaces 完成后取消 - 未开始的阶段全部跳过")
    void testCancelAfterInterfaces() {
        // Given: interfaces 完成事件触发取消
        AtomicReference<RunContext> holder = new AtomicReference<>();
        DomainEventPublisher publisher = event -> {
            if (event instanceof PhaseCompletedEvent
                    && ((PhaseCompletedEvent) event).getPhase().equals("interfaces")) {
                holder.get().requestCancel();
            }
        };
        RunContext ctx = new RunContext("run-cancel", null, publisher);
        holder.set(ctx);
        AtomicInteger downstreamCalls = new AtomicInteger();
        DeviceAction downstream = (device, directives, c) -> {
            downstreamCalls.incrementAndGet();
            return "ok";
        };

        // When
        OrchestrationResult result = run(diamond(OK, downstream, downstream, downstream), ctx);

        // Then
        assertTrue(result.isAllCompleted());
        assertEquals(3, result.phase("interfaces").getResult().count(OutcomeStatus.SUCCEEDED));
        for (String phase : List.of("routing", "vlans", "backup")) {
            PhaseResult phaseResult = result.phase(phase).getResult();
            assertEquals(3, phaseResult.count(OutcomeStatus.SKIPPED), phase);
            assertEquals(SkipCause.CANCELLED, phaseResult.outcomeOf("R1").getSkipCause());
        }
        assertEquals(0, downstreamCalls.get());
    }

    @Test
    @DisplayName("场景: 每个阶段只执行一次")
    void testEachPhaseRunsOnce() {
        AtomicInteger backupCalls = new AtomicInteger();
        DeviceAction backup = (device, directives, ctx) -> {
            Thread.sleep(5);
            return String.valueOf(backupCalls.incrementAndGet());
        };

        OrchestrationResult result = run(diamond(OK, OK, OK, backup), RunContext.standalone());

        assertEquals(3, backupCalls.get());
        assertEquals(PhaseState.COMPLETED, result.phase("backup").getState());
    }
}
