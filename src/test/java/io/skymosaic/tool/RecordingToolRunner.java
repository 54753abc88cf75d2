package io.skymosaic.tool;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Test double that records every command instead of spawning it. Commands
 * can be made to fail, and side effects can stand in for the files a real tool
 * would write.
 */
public final class RecordingToolRunner implements ExternalToolRunner {
    private final List<ToolCommand> commands = new CopyOnWriteArrayList<>();
    private final List<Failure> failures = new CopyOnWriteArrayList<>();
    private final List<Effect> effects = new CopyOnWriteArrayList<>();

    public RecordingToolRunner failOn(String tool, String stderr) {
        return failWhen(command -> toolName(command).equals(tool), stderr);
    }

    public RecordingToolRunner failWhen(Predicate<ToolCommand> predicate, String stderr) {
        failures.add(new Failure(predicate, stderr));
        return this;
    }

    public RecordingToolRunner onRun(String tool, SideEffect effect) {
        effects.add(new Effect(tool, effect));
        return this;
    }

    @Override
    public ToolResult run(ToolCommand command) {
        commands.add(command);
        for (Effect effect : effects) {
            if (effect.tool().equals(toolName(command))) {
                try {
                    effect.action().apply(command);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        }
        for (Failure failure : failures) {
            if (failure.predicate().test(command)) {
                return new ToolResult(command, false, 0, "", failure.stderr());
            }
        }
        return new ToolResult(command, true, 0, "", "");
    }

    public List<ToolCommand> commands() {
        return List.copyOf(commands);
    }

    public List<String> tools() {
        List<String> names = new ArrayList<>();
        for (ToolCommand command : commands) {
            names.add(toolName(command));
        }
        return names;
    }

    public List<ToolCommand> commandsFor(String tool) {
        List<ToolCommand> out = new ArrayList<>();
        for (ToolCommand command : commands) {
            if (toolName(command).equals(tool)) {
                out.add(command);
            }
        }
        return out;
    }

    public static String toolName(ToolCommand command) {
        return Path.of(command.executable()).getFileName().toString();
    }

    @FunctionalInterface
    public interface SideEffect {
        void apply(ToolCommand command) throws IOException;
    }

    private record Failure(Predicate<ToolCommand> predicate, String stderr) {
    }

    private record Effect(String tool, SideEffect action) {
    }
}
