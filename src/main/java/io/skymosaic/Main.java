package io.skymosaic;

import io.skymosaic.cli.SkyMosaicCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SkyMosaicCommand()).execute(args);
        System.exit(code);
    }
}
