package com.ryuqq.rollout.adapter.runner;

import com.ryuqq.rollout.core.config.RunnerConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunArguments 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunArgumentsTest {

    @Test
    void from_모든_항목이_설정되면_그대로_전달하고_tag는_쉼표로_합침() {
        // given
        RunnerConfiguration configuration = RunnerConfiguration.of(2)
            .withForce(true)
            .withServer("puppet.example.com:8140")
            .withNoop(true)
            .withEnvironment("production")
            .withSplay(true)
            .withSplayLimit(60)
            .withTags(List.of("one", "two"))
            .withIgnoreSchedules(true);

        // when
        Map<String, Object> arguments = RunArguments.from(configuration);

        // then
        assertThat(arguments).isEqualTo(Map.of(
            "splaylimit", 60,
            "force", true,
            "environment", "production",
            "noop", true,
            "server", "puppet.example.com:8140",
            "tags", "one,two",
            "splay", true,
            "ignoreschedules", true
        ));
    }

    @Test
    void from_설정되지_않은_항목은_키를_생략함() {
        // given
        RunnerConfiguration configuration = RunnerConfiguration.of(1).withNoop(false);

        // when
        Map<String, Object> arguments = RunArguments.from(configuration);

        // then
        assertThat(arguments).containsExactly(Map.entry("noop", false));
    }

    @Test
    void from_빈_tag_목록은_생략함() {
        // given
        RunnerConfiguration configuration = RunnerConfiguration.of(1).withTags(List.of());

        // when & then
        assertThat(RunArguments.from(configuration)).isEmpty();
    }

    @Test
    void forTrigger_force는_항상_true() {
        // given
        RunnerConfiguration configuration = RunnerConfiguration.of(1).withForce(false).withEnvironment("dev");

        // when
        Map<String, Object> arguments = RunArguments.forTrigger(configuration);

        // then
        assertThat(arguments).isEqualTo(Map.of("force", true, "environment", "dev"));
    }

    @Test
    void from_결과는_변경_불가() {
        // given
        Map<String, Object> arguments = RunArguments.from(RunnerConfiguration.of(1));

        // when & then
        assertThatThrownBy(() -> arguments.put("noop", true))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
