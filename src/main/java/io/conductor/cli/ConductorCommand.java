package io.conductor.cli;

import io.conductor.config.ConductorConfig;
import io.conductor.dispatch.DispatchRequest;
import io.conductor.dispatch.DispatchResponse;
import io.conductor.lifecycle.ReportOutcome;
import io.conductor.model.TaskRecord;
import io.conductor.runtime.ConductorRuntime;
import io.conductor.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "conductor",
        mixinStandardHelpOptions = true,
        description = "Dispatch coordinator for long-running coding agents",
        subcommands = {
                ConductorCommand.InitCommand.class,
                ConductorCommand.DispatchCommand.class,
                ConductorCommand.TaskCommand.class,
                ConductorCommand.TasksCommand.class,
                ConductorCommand.TaskExportCommand.class,
                ConductorCommand.ReportSuccessCommand.class,
                ConductorCommand.ReportFailureCommand.class,
                ConductorCommand.RunCommand.class,
                ConductorCommand.ReapCommand.class,
                ConductorCommand.DrainReportsCommand.class,
                ConductorCommand.AgentsCommand.class,
                ConductorCommand.SettingsCommand.class,
                ConductorCommand.AuditTailCommand.class
        }
)
public final class ConductorCommand implements Runnable {
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_BAD_REQUEST = 2;

    @Option(names = {"--root"}, description = "Data root directory (default: ~/.conductor)")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | dispatch | task | tasks | task-export | report-success | "
                + "report-failure | run | reap | drain-reports | agents | settings | audit-tail");
    }

    ConductorRuntime runtime() {
        ConductorRuntime runtime = new ConductorRuntime(ConductorConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static void printError(String message) {
        System.out.println(Jsons.toJson(Map.of("error", message == null ? "unknown error" : message)));
    }

    @Command(name = "init", description = "Initialize the data root and replay queued reports")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Override
        public Integer call() {
            ConductorRuntime runtime = new ConductorRuntime(ConductorConfig.fromRoot(parent.root));
            System.out.println(Jsons.toJson(runtime.initAndDrain()));
            return 0;
        }
    }

    @Command(name = "dispatch", description = "Admit a task and launch its agent in the background")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Option(names = {"--project"}, required = true, description = "Target project directory")
        String project;

        @Option(names = {"--content"}, description = "Task content")
        String content;

        @Option(names = {"--content-file"}, description = "Read task content from a file")
        String contentFile;

        @Option(names = {"--agent"}, required = true, description = "Agent kind (see `agents`)")
        String agent;

        @Option(names = {"--model"}, description = "Model override")
        String model;

        @Option(names = {"--add-dir"}, description = "Additional directory the agent may read (repeatable)")
        List<String> addDirs = new ArrayList<>();

        @Override
        public Integer call() throws Exception {
            if ((content == null) == (contentFile == null)) {
                printError("exactly one of --content or --content-file is required");
                return EXIT_BAD_REQUEST;
            }
            String body = content != null
                    ? content
                    : Files.readString(Path.of(contentFile), StandardCharsets.UTF_8);
            ConductorRuntime runtime = parent.runtime();
            try {
                DispatchResponse response = runtime.dispatch(new DispatchRequest(project, body, agent, model, addDirs));
                System.out.println(Jsons.toJson(response));
                return 0;
            } catch (IllegalArgumentException e) {
                printError(e.getMessage());
                return EXIT_BAD_REQUEST;
            }
        }
    }

    @Command(name = "task", description = "Show a task record by id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            Optional<TaskRecord> task = parent.runtime().getTask(taskId);
            if (task.isEmpty()) {
                printError("task not found");
                return EXIT_NOT_FOUND;
            }
            System.out.println(Jsons.toJson(task.get()));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List recent tasks, newest first")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listRecent(limit)));
            return 0;
        }
    }

    @Command(name = "task-export", description = "Export a task record and its audit rows to JSON")
    static final class TaskExportCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--out"}, description = "Output JSON path (default: <root>/exports/<taskId>.json)")
        String out;

        @Override
        public Integer call() {
            ConductorRuntime.TaskExportOutcome result = parent.runtime().exportTask(taskId, out);
            System.out.println(Jsons.toJson(result));
            return result.exported() ? 0 : EXIT_NOT_FOUND;
        }
    }

    @Command(name = "report-success", description = "Record successful completion of a task")
    static final class ReportSuccessCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--file"}, description = "Modified file (repeatable)")
        List<String> files = new ArrayList<>();

        @Option(names = {"--summary"}, defaultValue = "", description = "Outcome summary")
        String summary;

        @Option(names = {"--cli-output"}, description = "Compacted agent transcript")
        String cliOutput;

        @Override
        public Integer call() {
            ReportOutcome outcome = parent.runtime().reportSuccess(taskId, files, summary, cliOutput);
            System.out.println(Jsons.toJson(Map.of("taskId", taskId, "outcome", outcome)));
            return outcome == ReportOutcome.NOT_FOUND ? EXIT_NOT_FOUND : 0;
        }
    }

    @Command(name = "report-failure", description = "Record failure of a task")
    static final class ReportFailureCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--error"}, required = true, description = "Failure reason")
        String error;

        @Override
        public Integer call() {
            ReportOutcome outcome = parent.runtime().reportFailure(taskId, error);
            System.out.println(Jsons.toJson(Map.of("taskId", taskId, "outcome", outcome)));
            return outcome == ReportOutcome.NOT_FOUND ? EXIT_NOT_FOUND : 0;
        }
    }

    @Command(name = "run", description = "Run an admitted task in the foreground (used by the launcher)")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Option(names = {"--task-id"}, required = true, description = "Admitted task id")
        String taskId;

        @Option(names = {"--project"}, required = true, description = "Project directory")
        String project;

        @Option(names = {"--agent"}, required = true, description = "Agent kind")
        String agent;

        @Option(names = {"--model"}, description = "Model override")
        String model;

        @Option(names = {"--add-dir"}, description = "Additional directory (repeatable)")
        List<String> addDirs = new ArrayList<>();

        @Option(names = {"--prompt-file"}, required = true, description = "File holding the composed prompt")
        String promptFile;

        @Override
        public Integer call() {
            ConductorRuntime.RunRequest request = new ConductorRuntime.RunRequest(
                    taskId,
                    Paths.get(project),
                    agent,
                    model,
                    addDirs,
                    Paths.get(promptFile)
            );
            return parent.runtime().runTask(request, System.out);
        }
    }

    @Command(name = "reap", description = "Fail running tasks whose execution process has exited")
    static final class ReapCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(Map.of("reaped", parent.runtime().reap())));
            return 0;
        }
    }

    @Command(name = "drain-reports", description = "Replay reports queued while the ledger was unavailable")
    static final class DrainReportsCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().drainPendingReports()));
            return 0;
        }
    }

    @Command(name = "agents", description = "List configured agent backends")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().agents()));
            return 0;
        }
    }

    @Command(name = "settings", description = "Show effective dispatch settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().settings()));
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        ConductorCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Override
        public Integer call() {
            parent.runtime().auditTail(lines).forEach(row -> System.out.println(Jsons.toCompactJson(row)));
            return 0;
        }
    }
}
