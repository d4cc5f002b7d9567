package xyz.firestige.netops.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import xyz.firestige.netops.testutil.TimingExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("RunContext 单元测试")
class RunContextTest {

    @Test
    @DisplayName("场景: 运行级上下文总是允许提交")
    void runLevelContextAlwaysCommits() {
        RunContext ctx = RunContext.standalone();

        assertThat(ctx.beginCommit()).isTrue();
        assertThat(ctx.isAttemptAbandoned()).isFalse();
    }

    @Test
    @DisplayName("场景: 尝试被放弃后不能再提交")
    void abandonedAttemptCannotCommit() {
        RunContext attempt = RunContext.standalone().forAttempt();

        assertThat(attempt.abandonAttempt()).isTrue();
        assertThat(attempt.isAttemptAbandoned()).isTrue();
        assertThat(attempt.beginCommit()).isFalse();
    }

    @Test
    @DisplayName("场景: 已进入提交的尝试不能再被放弃")
    void committingAttemptCannotBeAbandoned() {
        RunContext attempt = RunContext.standalone().forAttempt();

        assertThat(attempt.beginCommit()).isTrue();
        assertThat(attempt.abandonAttempt()).isFalse();
        assertThat(attempt.beginCommit()).isTrue();
        assertThat(attempt.isAttemptAbandoned()).isFalse();
    }

    @Test
    @DisplayName("场景: 尝试与运行共享取消信号，尝试状态彼此独立")
    void attemptsShareCancellation() {
        RunContext run = new RunContext("run-7", null, null);
        RunContext first = run.forAttempt();
        RunContext second = run.forAttempt();

        first.abandonAttempt();
        run.requestCancel();

        assertThat(second.isAttemptAbandoned()).isFalse();
        assertThat(first.isCancelRequested()).isTrue();
        assertThat(second.getRunId()).isEqualTo("run-7");
    }
}
