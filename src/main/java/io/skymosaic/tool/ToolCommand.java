package io.skymosaic.tool;

import java.util.ArrayList;
import java.util.List;

/**
 * A boundary command: executable plus positional arguments, in the exact order
 * the external tool expects.
 */
public record ToolCommand(String executable, List<String> args) {
    public ToolCommand {
        if (executable == null || executable.isBlank()) {
            throw new IllegalArgumentException("tool executable cannot be empty");
        }
        args = args == null ? List.of() : List.copyOf(args);
    }

    public static ToolCommand of(String executable, Object... args) {
        List<String> out = new ArrayList<>(args.length);
        for (Object arg : args) {
            out.add(String.valueOf(arg));
        }
        return new ToolCommand(executable, out);
    }

    public List<String> argv() {
        List<String> argv = new ArrayList<>(args.size() + 1);
        argv.add(executable);
        argv.addAll(args);
        return argv;
    }

    public String render() {
        return String.join(" ", argv());
    }

    @Override
    public String toString() {
        return render();
    }
}
