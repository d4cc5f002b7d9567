package xyz.firestige.netops.report;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import xyz.firestige.netops.domain.outcome.OutcomeStatus;
import xyz.firestige.netops.event.PhaseCompletedEvent;
import xyz.firestige.netops.exception.CommandRejectedException;
import xyz.firestige.netops.execution.DeviceAction;
import xyz.firestige.netops.execution.PhaseExecutor;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.execution.retry.RetryStrategy;
import xyz.firestige.netops.orchestration.OrchestrationResult;
import xyz.firestige.netops.orchestration.Orchestrator;
import xyz.firestige.netops.orchestration.PhaseDefinition;
import xyz.firestige.netops.orchestration.PhaseGraph;
import xyz.firestige.netops.testutil.TestFleet;
import xyz.firestige.netops.testutil.TimingExtension;
import xyz.firestige.netops.validation.ValidationError;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("RunReportAssembler 单元测试")
class RunReportAssemblerTest {

    private final RunReportAssembler assembler = new RunReportAssembler();
    private PhaseExecutor phaseExecutor;

    @BeforeEach
    void setUp() {
        phaseExecutor = new PhaseExecutor(4, RetryStrategy.none(), null);
    }

    @AfterEach
    void tearDown() {
        phaseExecutor.close();
    }

    private OrchestrationResult runTwoPhases(DeviceAction first, DeviceAction second, RunContext ctx) {
        PhaseGraph graph = PhaseGraph.builder()
                .phase(PhaseDefinition.builder("interfaces").action(first).build())
                .phase(PhaseDefinition.builder("routing").dependsOn("interfaces").action(second).build())
                .build();
        return new Orchestrator(phaseExecutor).run(graph, TestFleet.inventory(), TestFleet.intents(), ctx);
    }

    @Test
    @DisplayName("场景: 全部成功 - SUCCESS")
    void testAllSucceeded() {
        DeviceAction ok = (device, directives, ctx) -> "ok";

        RunReport report = assembler.assemble(runTwoPhases(ok, ok, RunContext.standalone()));

        assertEquals(RunStatus.SUCCESS, report.getStatus());
        assertTrue(report.isSuccess());
        assertEquals(new RunSummary(6, 6, 0, 0), report.getSummary());
        assertTrue(report.getFailures().isEmpty());
    }

    @Test
    @DisplayName("场景: 存在失败 - PARTIAL_FAILURE，失败条目带阶段、设备与原因")
    void testPartialFailure() {
        // Given
        DeviceAction rejectOnR2 = (device, directives, ctx) -> {
            if (device.getName().equals("R2")) {
                throw new CommandRejectedException("router ospf 1", "% Invalid input detected at '^' marker.");
            }
            return "ok";
        };

        // When
        RunReport report = assembler.assemble(runTwoPhases((d, s, c) -> "ok", rejectOnR2, RunContext.standalone()));

        // Then
        assertEquals(RunStatus.PARTIAL_FAILURE, report.getStatus());
        assertEquals(1, report.getFailures().size());
        ReportEntry failure = report.getFailures().get(0);
        assertEquals("routing", failure.getPhase());
        assertEquals("R2", failure.getDevice());
        assertEquals("COMMAND_REJECTED", failure.getErrorCode());
        assertTrue(failure.getReason().contains("router ospf 1"));
        assertEquals(OutcomeStatus.SUCCEEDED, report.entry("routing", "R1").orElseThrow().getStatus());
        assertEquals(3, report.entriesOf("interfaces").size());
    }

    @Test
    @DisplayName("场景: 取消导致的跳过不算失败")
    void testSkippedIsNotFailure() {
        // Given: interfaces 阶段结束时发出取消
        AtomicReference<RunContext> holder = new AtomicReference<>();
        RunContext ctx = new RunContext("run-cancel", null, event -> {
            if (event instanceof PhaseCompletedEvent) {
                holder.get().requestCancel();
            }
        });
        holder.set(ctx);
        DeviceAction ok = (device, directives, c) -> "ok";

        // When
        RunReport report = assembler.assemble(runTwoPhases(ok, ok, ctx));

        // Then
        assertEquals(RunStatus.SUCCESS, report.getStatus());
        assertEquals(new RunSummary(6, 3, 0, 3), report.getSummary());
        assertEquals(OutcomeStatus.SKIPPED, report.entry("routing", "R1").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("场景: 校验失败 - ABORTED，没有设备条目")
    void testAborted() {
        List<ValidationError> violations = List.of(
                ValidationError.of("R9", "device", "DEVICE_NOT_FOUND", "设备不在清单中: R9"));

        RunReport report = assembler.aborted("run-1", LocalDateTime.now(), violations);

        assertEquals(RunStatus.ABORTED, report.getStatus());
        assertFalse(report.isSuccess());
        assertTrue(report.getEntries().isEmpty());
        assertEquals(violations, report.getViolations());
    }
}
