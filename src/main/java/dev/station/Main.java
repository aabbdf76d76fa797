package dev.station;

import dev.station.cli.StationCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new StationCli()).execute(args);
        System.exit(exitCode);
    }
}
