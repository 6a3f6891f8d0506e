package it.unimib.datai.faaslocal.scheduler.process;

import it.unimib.datai.faaslocal.common.model.BuildOptions;

import java.util.ArrayList;
import java.util.List;

public final class LaunchCommand {
    /** Function name used when invoking the package's default binary. */
    public static final String DEFAULT_PACKAGE_FUNCTION = "_";

    private LaunchCommand() {}

    public static List<String> toCommand(String cargo, BuildOptions options, String functionName) {
        List<String> cmd = new ArrayList<>();
        cmd.add(cargo);

        if (!options.noReload()) {
            cmd.add("watch");
            cmd.addAll(options.watchArgs());
            cmd.add("--");
            cmd.add(cargo);
        }
        cmd.add("run");

        if (options.features() != null && !options.features().isBlank()) {
            cmd.add("--features");
            cmd.add(options.features());
        }

        if (options.release()) {
            cmd.add("--release");
        }

        String bin = binName(functionName);
        if (bin != null) {
            cmd.add("--bin");
            cmd.add(bin);
        }
        return cmd;
    }

    /**
     * @return the binary to select for the function, or null to let the run command infer it
     */
    public static String binName(String functionName) {
        if (functionName == null || functionName.isEmpty() || DEFAULT_PACKAGE_FUNCTION.equals(functionName)) {
            return null;
        }
        return functionName;
    }
}
