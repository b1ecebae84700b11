package io.kestra.plugin.adldap;

import io.kestra.core.models.annotations.PluginProperty;
import io.kestra.core.models.executions.metrics.Counter;
import io.kestra.core.models.executions.metrics.Timer;
import io.kestra.core.models.tasks.RunnableTask;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.client.Adldap;
import io.kestra.plugin.adldap.management.Groups;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;
import org.slf4j.Logger;

import java.time.Duration;

/**
 * Shared run loop of the tasks changing one group: open the directory, apply the change, report it.
 * The directory outcome is returned in the output, a refused change only failing the task when
 * {@code failOnRefusal} is set.
 */
@SuperBuilder
@Getter
@NoArgsConstructor
public abstract class AbstractGroupTask extends AdldapConnection implements RunnableTask<AbstractGroupTask.Output> {
    @Schema(
        title = "Group",
        description = "Name of the group, resolved through ambiguous name resolution."
    )
    @PluginProperty(dynamic = true)
    @NotNull
    protected String group;

    @Schema(
        title = "Fail when the directory refuses the change",
        description = "By default a refused change, or a group or member that can't be found, is logged and reported as `success: false`."
    )
    @PluginProperty
    @Builder.Default
    protected Boolean failOnRefusal = false;

    @Builder
    @Getter
    public static class Output implements io.kestra.core.models.tasks.Output {
        @Schema(
            title = "Whether the directory accepted the change"
        )
        private final Boolean success;
    }

    protected abstract boolean apply(Groups groups, String groupName, RunContext runContext) throws Exception;

    @Override
    public Output run(RunContext runContext) throws Exception {
        Logger logger = runContext.logger();
        String origin = this.getClass().getSimpleName();
        String rGroup = runContext.render(this.group);

        boolean success;
        long startTime = System.currentTimeMillis();
        try (Adldap directory = this.openDirectory(runContext)) {
            success = this.apply(directory.groups(), rGroup, runContext);
        }
        long duration = System.currentTimeMillis() - startTime;

        if (success) {
            logger.info("{} applied to group '{}'", origin, rGroup);
        } else if (Boolean.TRUE.equals(this.failOnRefusal)) {
            throw new IllegalStateException(String.format("%s refused for group '%s', see previous logs.", origin, rGroup));
        } else {
            logger.warn("{} refused for group '{}'", origin, rGroup);
        }

        runContext.metric(Counter.of("changes.done", success ? 1 : 0, "origin", origin));
        runContext.metric(Timer.of("change.time", Duration.ofMillis(duration), "origin", origin));

        return Output.builder()
            .success(success)
            .build();
    }
}
